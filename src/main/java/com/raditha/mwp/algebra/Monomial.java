package com.raditha.mwp.algebra;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A scalar guarded by a set of choice constraints. It contributes {@code scalar}
 * when every delta matches the choice vector and o otherwise.
 * <p>
 * Deltas are kept sorted by index with at most one delta per index. Two deltas
 * that disagree at the same index make the monomial unsatisfiable, so it collapses
 * to {@link #ZERO}. A monomial with scalar o never carries deltas.
 *
 * @param scalar the contributed scalar
 * @param deltas the guarding constraints, sorted by index
 */
public record Monomial(Scalar scalar, List<Delta> deltas) {

    public static final Monomial ZERO = new Monomial(Scalar.O, List.of());

    /**
     * Orders monomials by their delta lists only; scalars are ignored.
     */
    public static final Comparator<Monomial> BY_DELTAS = (a, b) -> Delta.compareLists(a.deltas, b.deltas);

    public Monomial {
        if (scalar == null) {
            throw new IllegalArgumentException("scalar cannot be null");
        }
        List<Delta> sorted = normalize(deltas);
        if (sorted == null || scalar == Scalar.O) {
            scalar = Scalar.O;
            deltas = List.of();
        } else {
            deltas = sorted;
        }
    }

    public Monomial(Scalar scalar, Delta... deltas) {
        this(scalar, List.of(deltas));
    }

    /**
     * Sort and deduplicate the deltas.
     *
     * @return the sorted list or null when two deltas conflict
     */
    private static List<Delta> normalize(List<Delta> deltas) {
        if (deltas == null || deltas.isEmpty()) {
            return List.of();
        }
        List<Delta> sorted = new ArrayList<>(deltas);
        sorted.sort(Delta.ORDER);
        List<Delta> result = new ArrayList<>(sorted.size());
        for (Delta d : sorted) {
            if (!result.isEmpty()) {
                Delta last = result.get(result.size() - 1);
                if (last.index() == d.index()) {
                    if (last.value() != d.value()) {
                        return null;
                    }
                    continue;
                }
            }
            result.add(d);
        }
        return List.copyOf(result);
    }

    public boolean isZero() {
        return scalar == Scalar.O;
    }

    /**
     * Add a constraint. Re-inserting a delta that is already present has no effect;
     * inserting a different value at an occupied index yields {@link #ZERO}.
     */
    public Monomial insert(Delta delta) {
        if (isZero()) {
            return ZERO;
        }
        List<Delta> merged = new ArrayList<>(deltas);
        merged.add(delta);
        return new Monomial(scalar, merged);
    }

    /**
     * Product of two monomials: semiring product of the scalars and the union of
     * the constraints.
     */
    public Monomial product(Monomial other) {
        Scalar s = scalar.product(other.scalar);
        if (s == Scalar.O) {
            return ZERO;
        }
        List<Delta> merged = new ArrayList<>(deltas.size() + other.deltas.size());
        merged.addAll(deltas);
        merged.addAll(other.deltas);
        return new Monomial(s, merged);
    }

    public Monomial withScalar(Scalar s) {
        return new Monomial(s, deltas);
    }

    /**
     * Evaluate under a complete choice vector, where {@code choices[k]} is the
     * choice made at index k.
     */
    public Scalar evaluate(int[] choices) {
        for (Delta d : deltas) {
            if (d.index() >= choices.length) {
                throw new IllegalArgumentException(
                        "Choice vector of length " + choices.length + " does not cover index " + d.index());
            }
            if (choices[d.index()] != d.value()) {
                return Scalar.O;
            }
        }
        return scalar;
    }

    @Override
    public String toString() {
        if (deltas.isEmpty()) {
            return scalar.symbol();
        }
        return scalar.symbol() + deltas.stream().map(Delta::toString).collect(Collectors.joining(""));
    }
}
