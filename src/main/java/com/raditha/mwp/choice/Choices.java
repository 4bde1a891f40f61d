package com.raditha.mwp.choice;

import com.raditha.mwp.algebra.Delta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * The safe choice vectors of a relation, summarized as one allowed value set per
 * choice index. A vector is safe when every choice lies in its index's set.
 *
 * @param domain   the legal values at every index
 * @param index    the number of choice indices
 * @param allowed  allowed values per index, each sorted
 * @param infinite true when no safe vector exists
 */
public record Choices(List<Integer> domain, int index, List<List<Integer>> allowed, boolean infinite) {

    private static final Logger logger = LoggerFactory.getLogger(Choices.class);

    public static final List<Integer> DEFAULT_DOMAIN = List.of(0, 1, 2);

    public Choices {
        if (domain == null || domain.isEmpty()) {
            throw new IllegalArgumentException("domain cannot be empty");
        }
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
        if (allowed == null || allowed.size() != index) {
            throw new IllegalArgumentException("allowed must hold one set per index");
        }
        domain = List.copyOf(domain);
        allowed = allowed.stream().map(List::copyOf).toList();
    }

    /**
     * Derive the allowed sets from infinity witnesses with the set reducer.
     */
    public static Choices generate(List<Integer> domain, int index, Collection<List<Delta>> witnesses) {
        return generate(domain, index, witnesses, ReductionStrategy.SET);
    }

    /**
     * Derive the allowed sets from infinity witnesses.
     * <p>
     * The witnesses are minimized, then the last delta of every minimized witness
     * removes its value from the allowed set of its index. An empty witness means
     * every vector is unsafe.
     *
     * @param domain    the legal values at every index
     * @param index     the number of choice indices
     * @param witnesses delta lists of the i-monomials, each sorted by index
     * @param strategy  the witness minimization to use
     * @throws IllegalStateException if a witness refers to an index or value that
     *                               cannot be chosen
     */
    public static Choices generate(List<Integer> domain, int index, Collection<List<Delta>> witnesses,
                                   ReductionStrategy strategy) {
        Set<List<Delta>> minimized = strategy.reducer().minimize(domain, witnesses);
        logger.debug("Minimized {} witnesses to {}", witnesses.size(), minimized);

        List<Set<Integer>> sets = new ArrayList<>(index);
        for (int k = 0; k < index; k++) {
            sets.add(new TreeSet<>(domain));
        }
        boolean unconditional = false;
        for (List<Delta> witness : minimized) {
            for (Delta d : witness) {
                if (d.index() >= index || !domain.contains(d.value())) {
                    throw new IllegalStateException("Witness " + witness + " is not achievable with "
                            + index + " indices over " + domain);
                }
            }
            if (witness.isEmpty()) {
                unconditional = true;
            } else {
                Delta last = witness.get(witness.size() - 1);
                sets.get(last.index()).remove(last.value());
            }
        }
        if (unconditional) {
            sets.forEach(Set::clear);
        }
        boolean infinite = unconditional || sets.stream().anyMatch(Set::isEmpty);
        List<List<Integer>> allowed = sets.stream().map(s -> (List<Integer>) new ArrayList<>(s)).toList();
        return new Choices(domain, index, allowed, infinite);
    }

    /**
     * Choices with no safe vector at all.
     */
    public static Choices infinite(List<Integer> domain, int index) {
        List<List<Integer>> allowed = new ArrayList<>(index);
        for (int k = 0; k < index; k++) {
            allowed.add(List.of());
        }
        return new Choices(domain, index, allowed, true);
    }

    /**
     * Check a complete choice vector.
     */
    public boolean isValid(int... choices) {
        if (infinite || choices.length != index) {
            return false;
        }
        for (int k = 0; k < choices.length; k++) {
            if (!allowed.get(k).contains(choices[k])) {
                return false;
            }
        }
        return true;
    }

    /**
     * The safe vector that picks the smallest allowed value at every index.
     *
     * @throws IllegalStateException if no safe vector exists
     */
    public int[] first() {
        if (infinite) {
            throw new IllegalStateException("No safe choice vector exists");
        }
        int[] vector = new int[index];
        for (int k = 0; k < index; k++) {
            vector[k] = allowed.get(k).get(0);
        }
        return vector;
    }

    /**
     * Number of safe choice vectors.
     */
    public BigInteger count() {
        if (infinite) {
            return BigInteger.ZERO;
        }
        BigInteger total = BigInteger.ONE;
        for (List<Integer> values : allowed) {
            total = total.multiply(BigInteger.valueOf(values.size()));
        }
        return total;
    }
}
