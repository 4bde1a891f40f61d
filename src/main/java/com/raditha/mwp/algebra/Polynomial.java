package com.raditha.mwp.algebra;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * An immutable, ordered list of non-zero monomials with pairwise distinct delta
 * lists. The empty list is the zero polynomial.
 */
public final class Polynomial {

    public static final Polynomial ZERO = new Polynomial(List.of());
    public static final Polynomial UNIT = new Polynomial(List.of(new Monomial(Scalar.M)));

    private final List<Monomial> monomials;

    private Polynomial(List<Monomial> canonical) {
        this.monomials = canonical;
    }

    /**
     * Build a polynomial from arbitrary monomials. Zero monomials are dropped and
     * monomials with equal delta lists are combined with the semiring sum.
     */
    public static Polynomial of(Collection<Monomial> monomials) {
        List<Monomial> sorted = new ArrayList<>(monomials);
        sorted.sort(Monomial.BY_DELTAS);
        List<Monomial> result = new ArrayList<>(sorted.size());
        for (Monomial m : sorted) {
            appendCombining(result, m);
        }
        return wrap(result);
    }

    public static Polynomial of(Monomial... monomials) {
        return of(List.of(monomials));
    }

    public static Polynomial of(Scalar scalar) {
        return of(new Monomial(scalar));
    }

    /**
     * The three-branch polynomial for one choice index: branch k contributes
     * {@code scalars[k]} under the constraint (k, index).
     */
    public static Polynomial fromScalars(int index, Scalar... scalars) {
        List<Monomial> terms = new ArrayList<>(scalars.length);
        for (int k = 0; k < scalars.length; k++) {
            terms.add(new Monomial(scalars[k], new Delta(k, index)));
        }
        return of(terms);
    }

    public List<Monomial> monomials() {
        return monomials;
    }

    public boolean isZero() {
        return monomials.isEmpty();
    }

    /**
     * Sum of two polynomials as a linear merge of the two sorted lists.
     */
    public Polynomial add(Polynomial other) {
        if (other.isZero()) {
            return this;
        }
        if (isZero()) {
            return other;
        }
        List<Monomial> result = new ArrayList<>(monomials.size() + other.monomials.size());
        int i = 0;
        int j = 0;
        while (i < monomials.size() && j < other.monomials.size()) {
            Monomial a = monomials.get(i);
            Monomial b = other.monomials.get(j);
            int c = Monomial.BY_DELTAS.compare(a, b);
            if (c < 0) {
                result.add(a);
                i++;
            } else if (c > 0) {
                result.add(b);
                j++;
            } else {
                result.add(a.withScalar(a.scalar().sum(b.scalar())));
                i++;
                j++;
            }
        }
        result.addAll(monomials.subList(i, monomials.size()));
        result.addAll(other.monomials.subList(j, other.monomials.size()));
        return wrap(result);
    }

    /**
     * Multiply every term by a single monomial.
     */
    public Polynomial multiply(Monomial factor) {
        if (factor.isZero() || isZero()) {
            return ZERO;
        }
        List<Monomial> products = new ArrayList<>(monomials.size());
        for (Monomial m : monomials) {
            Monomial product = m.product(factor);
            if (!product.isZero()) {
                products.add(product);
            }
        }
        // a product can reorder delta lists, so the result is re-sorted
        return of(products);
    }

    /**
     * Full distributive product. Each term of this polynomial yields one sorted
     * list of products; the lists are combined with a k-way merge.
     */
    public Polynomial times(Polynomial other) {
        if (isZero() || other.isZero()) {
            return ZERO;
        }
        PriorityQueue<Cursor> queue = new PriorityQueue<>(
                (a, b) -> Monomial.BY_DELTAS.compare(a.current, b.current));
        for (Monomial m : monomials) {
            Cursor cursor = new Cursor(other.multiply(m).monomials.iterator());
            if (cursor.advance()) {
                queue.add(cursor);
            }
        }
        List<Monomial> result = new ArrayList<>();
        while (!queue.isEmpty()) {
            Cursor cursor = queue.poll();
            appendCombining(result, cursor.current);
            if (cursor.advance()) {
                queue.add(cursor);
            }
        }
        return wrap(result);
    }

    /**
     * Semiring sum of the monomials evaluated under a choice vector.
     */
    public Scalar evaluate(int[] choices) {
        Scalar value = Scalar.O;
        for (Monomial m : monomials) {
            value = value.sum(m.evaluate(choices));
        }
        return value;
    }

    /**
     * Rewrite the scalar of every monomial.
     */
    public Polynomial mapScalars(UnaryOperator<Scalar> mapping) {
        List<Monomial> mapped = new ArrayList<>(monomials.size());
        for (Monomial m : monomials) {
            mapped.add(m.withScalar(mapping.apply(m.scalar())));
        }
        return of(mapped);
    }

    public boolean hasInfinity() {
        for (Monomial m : monomials) {
            if (m.scalar() == Scalar.I) {
                return true;
            }
        }
        return false;
    }

    /**
     * Delta lists of the monomials whose scalar is i.
     */
    public List<List<Delta>> infinityWitnesses() {
        List<List<Delta>> witnesses = new ArrayList<>();
        for (Monomial m : monomials) {
            if (m.scalar() == Scalar.I) {
                witnesses.add(m.deltas());
            }
        }
        return witnesses;
    }

    private static void appendCombining(List<Monomial> sorted, Monomial m) {
        if (m.isZero()) {
            return;
        }
        if (!sorted.isEmpty()) {
            int lastIndex = sorted.size() - 1;
            Monomial last = sorted.get(lastIndex);
            if (Monomial.BY_DELTAS.compare(last, m) == 0) {
                sorted.set(lastIndex, last.withScalar(last.scalar().sum(m.scalar())));
                return;
            }
        }
        sorted.add(m);
    }

    private static Polynomial wrap(List<Monomial> canonical) {
        if (canonical.isEmpty()) {
            return ZERO;
        }
        return new Polynomial(List.copyOf(canonical));
    }

    private static final class Cursor {
        private final Iterator<Monomial> iterator;
        private Monomial current;

        Cursor(Iterator<Monomial> iterator) {
            this.iterator = iterator;
        }

        boolean advance() {
            if (iterator.hasNext()) {
                current = iterator.next();
                return true;
            }
            return false;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Polynomial other && monomials.equals(other.monomials);
    }

    @Override
    public int hashCode() {
        return monomials.hashCode();
    }

    @Override
    public String toString() {
        if (monomials.isEmpty()) {
            return "o";
        }
        return monomials.stream().map(Monomial::toString).collect(Collectors.joining("+"));
    }
}
