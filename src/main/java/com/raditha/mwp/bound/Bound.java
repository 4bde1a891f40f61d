package com.raditha.mwp.bound;

import com.raditha.mwp.algebra.Scalar;
import com.raditha.mwp.relation.Relation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Per-variable mwp-bounds of a relation evaluated under one safe choice vector.
 */
public final class Bound {

    private final Map<String, MwpBound> bounds;

    public Bound(Map<String, MwpBound> bounds) {
        this.bounds = new LinkedHashMap<>(bounds);
    }

    /**
     * Compute the bound of every column variable.
     *
     * @param relation the relation
     * @param choices  a complete, safe choice vector
     */
    public static Bound calculate(Relation relation, int[] choices) {
        Scalar[][] values = relation.evaluate(choices);
        List<String> variables = relation.variables();
        Map<String, MwpBound> bounds = new LinkedHashMap<>();
        for (int col = 0; col < variables.size(); col++) {
            List<String> m = new ArrayList<>();
            List<String> w = new ArrayList<>();
            List<String> p = new ArrayList<>();
            for (int row = 0; row < variables.size(); row++) {
                Scalar s = values[row][col];
                if (row == col && s == Scalar.O && !relation.matrix().get(row, col).isZero()) {
                    // a diagonal dependency no monomial selects keeps the variable itself
                    s = Scalar.M;
                }
                if (s == Scalar.M) {
                    m.add(variables.get(row));
                } else if (s == Scalar.W) {
                    w.add(variables.get(row));
                } else if (s == Scalar.P) {
                    p.add(variables.get(row));
                }
            }
            bounds.put(variables.get(col), new MwpBound(m, w, p));
        }
        return new Bound(bounds);
    }

    /**
     * Restore a bound from its triple form.
     */
    public static Bound fromTriples(Map<String, String> triples) {
        Map<String, MwpBound> bounds = new LinkedHashMap<>();
        triples.forEach((k, v) -> bounds.put(k, MwpBound.parse(v)));
        return new Bound(bounds);
    }

    public Map<String, String> toTriples() {
        Map<String, String> triples = new LinkedHashMap<>();
        bounds.forEach((k, v) -> triples.put(k, v.triple()));
        return triples;
    }

    public Map<String, MwpBound> bounds() {
        return Collections.unmodifiableMap(bounds);
    }

    public MwpBound get(String variable) {
        return bounds.get(variable);
    }

    public List<String> variables() {
        return List.copyOf(bounds.keySet());
    }

    /**
     * Display form, one {@code X' <= expr} per variable joined by a conjunction.
     *
     * @param significant omit variables bounded only by themselves
     */
    public String show(boolean significant) {
        return bounds.entrySet().stream()
                .filter(e -> !significant || !e.getValue().dependsOnlyOn(e.getKey()))
                .map(e -> e.getKey() + "' <= " + e.getValue().expression())
                .collect(Collectors.joining(" && "));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Bound other && bounds.equals(other.bounds);
    }

    @Override
    public int hashCode() {
        return bounds.hashCode();
    }

    @Override
    public String toString() {
        return show(false);
    }
}
