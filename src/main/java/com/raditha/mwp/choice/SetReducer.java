package com.raditha.mwp.choice;

import com.raditha.mwp.algebra.Delta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Witness minimization over plain sets.
 * <p>
 * Each round collects every contraction: witnesses that are identical except at
 * one index, and whose values at that index cover the whole domain, imply the
 * witness without that index. The contractions are added, superset witnesses are
 * removed, and rounds repeat until nothing changes.
 */
public class SetReducer implements WitnessReducer {

    private static final Logger logger = LoggerFactory.getLogger(SetReducer.class);

    private record ContractionKey(List<Delta> rest, int index) {
    }

    @Override
    public Set<List<Delta>> minimize(List<Integer> domain, Collection<List<Delta>> witnesses) {
        Set<List<Delta>> current = WitnessReducer.subsume(witnesses);
        int round = 0;
        while (true) {
            round++;
            Set<List<Delta>> candidates = new LinkedHashSet<>(current);
            candidates.addAll(contractions(domain, current));
            Set<List<Delta>> next = WitnessReducer.subsume(candidates);
            if (next.equals(current)) {
                logger.debug("Witness set stable after {} rounds: {} witnesses", round, current.size());
                return current;
            }
            current = next;
        }
    }

    private static Set<List<Delta>> contractions(List<Integer> domain, Set<List<Delta>> witnesses) {
        Map<ContractionKey, Set<Integer>> covered = new HashMap<>();
        for (List<Delta> w : witnesses) {
            for (int k = 0; k < w.size(); k++) {
                ContractionKey key = new ContractionKey(WitnessReducer.without(w, k), w.get(k).index());
                covered.computeIfAbsent(key, x -> new HashSet<>()).add(w.get(k).value());
            }
        }
        Set<List<Delta>> result = new LinkedHashSet<>();
        for (Map.Entry<ContractionKey, Set<Integer>> entry : covered.entrySet()) {
            if (entry.getValue().containsAll(domain)) {
                result.add(entry.getKey().rest());
            }
        }
        return result;
    }
}
