package com.raditha.mwp.choice;

import com.raditha.mwp.algebra.Delta;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Minimizes a set of infinity witnesses. A witness is a delta list, sorted by
 * index, whose choices force the scalar i somewhere in a relation.
 */
public interface WitnessReducer {

    /**
     * Reduce the witnesses to a minimal set that describes the same unsafe choices.
     *
     * @param domain    the legal values at every choice index
     * @param witnesses the witnesses, each sorted by index
     * @return the minimized witnesses; contains the empty list when infinity is unconditional
     */
    Set<List<Delta>> minimize(List<Integer> domain, Collection<List<Delta>> witnesses);

    /**
     * Drop every witness that is a strict superset of another witness.
     */
    static Set<List<Delta>> subsume(Collection<List<Delta>> witnesses) {
        List<List<Delta>> distinct = new ArrayList<>(new LinkedHashSet<>(witnesses));
        List<Set<Delta>> asSets = new ArrayList<>(distinct.size());
        for (List<Delta> w : distinct) {
            asSets.add(new HashSet<>(w));
        }
        Set<List<Delta>> kept = new LinkedHashSet<>();
        for (int a = 0; a < distinct.size(); a++) {
            boolean subsumed = false;
            for (int b = 0; b < distinct.size() && !subsumed; b++) {
                subsumed = a != b
                        && asSets.get(b).size() < asSets.get(a).size()
                        && asSets.get(a).containsAll(asSets.get(b));
            }
            if (!subsumed) {
                kept.add(distinct.get(a));
            }
        }
        return kept;
    }

    /**
     * Remove the delta at {@code position}.
     */
    static List<Delta> without(List<Delta> witness, int position) {
        List<Delta> rest = new ArrayList<>(witness.size() - 1);
        for (int k = 0; k < witness.size(); k++) {
            if (k != position) {
                rest.add(witness.get(k));
            }
        }
        return List.copyOf(rest);
    }
}
