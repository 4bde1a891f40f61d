package com.raditha.mwp.algebra;

import java.util.Comparator;
import java.util.List;

/**
 * A single choice constraint: the choice made at {@code index} must equal {@code value}.
 *
 * @param value the derivation branch (0, 1 or 2)
 * @param index the choice index this constraint applies to
 */
public record Delta(int value, int index) implements Comparable<Delta> {

    public static final Comparator<Delta> ORDER = Comparator.comparingInt(Delta::index)
            .thenComparingInt(Delta::value);

    public Delta {
        if (value < 0) {
            throw new IllegalArgumentException("value must be >= 0");
        }
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
    }

    @Override
    public int compareTo(Delta other) {
        return ORDER.compare(this, other);
    }

    /**
     * Compare two delta lists element by element; a proper prefix sorts first.
     */
    public static int compareLists(List<Delta> a, List<Delta> b) {
        int n = Math.min(a.size(), b.size());
        for (int k = 0; k < n; k++) {
            int c = a.get(k).compareTo(b.get(k));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    @Override
    public String toString() {
        return "(" + value + "," + index + ")";
    }
}
