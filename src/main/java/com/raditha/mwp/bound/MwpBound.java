package com.raditha.mwp.bound;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;

/**
 * The bound of one variable: the variables it depends on with scalar m, w and p.
 *
 * @param maxVars   m-variables, combined with max
 * @param weakVars  w-variables, combined with +
 * @param polyVars  p-variables, combined with *
 */
public record MwpBound(List<String> maxVars, List<String> weakVars, List<String> polyVars) {

    public MwpBound {
        maxVars = sorted(maxVars);
        weakVars = sorted(weakVars);
        polyVars = sorted(polyVars);
    }

    private static List<String> sorted(List<String> vars) {
        return vars == null ? List.of() : List.copyOf(new TreeSet<>(vars));
    }

    /**
     * Parse the {@code m;w;p} triple form, e.g. {@code "X,Y;;Z"}.
     *
     * @throws IllegalArgumentException if the value does not have three parts
     */
    public static MwpBound parse(String triple) {
        if (triple == null || triple.isEmpty()) {
            return new MwpBound(List.of(), List.of(), List.of());
        }
        String[] parts = triple.split(";", -1);
        if (parts.length != 3) {
            throw new IllegalArgumentException("Bound triple must have three parts: " + triple);
        }
        List<List<String>> lists = new ArrayList<>(3);
        for (String part : parts) {
            lists.add(part.isEmpty() ? List.of() : Arrays.asList(part.split(",")));
        }
        return new MwpBound(lists.get(0), lists.get(1), lists.get(2));
    }

    /**
     * The {@code m;w;p} triple form.
     */
    public String triple() {
        return String.join(",", maxVars) + ";" + String.join(",", weakVars) + ";" + String.join(",", polyVars);
    }

    /**
     * The bound expression, e.g. {@code max(X,Y+Z)+U*V}.
     */
    public String expression() {
        String max = String.join(",", maxVars);
        String weak = String.join("+", weakVars);
        String poly = String.join("*", polyVars);
        String term = null;
        if (!maxVars.isEmpty() && !weakVars.isEmpty()) {
            term = "max(" + max + "," + weak + ")";
        } else if (!maxVars.isEmpty()) {
            term = maxVars.size() > 1 || !polyVars.isEmpty() ? "max(" + max + ",0)" : max;
        } else if (!weakVars.isEmpty()) {
            term = weakVars.size() > 1 || !polyVars.isEmpty() ? "max(" + weak + ",0)" : weak;
        }
        if (term != null) {
            return polyVars.isEmpty() ? term : term + "+" + poly;
        }
        return polyVars.isEmpty() ? "0" : poly;
    }

    /**
     * True when the variable is bounded by nothing but its own old value.
     */
    public boolean dependsOnlyOn(String variable) {
        return maxVars.equals(List.of(variable)) && weakVars.isEmpty() && polyVars.isEmpty();
    }
}
