package com.raditha.mwp.choice;

import com.raditha.mwp.algebra.Delta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Graph formulation of witness minimization.
 * <p>
 * Witnesses are nodes grouped by length. Two nodes of equal length are joined by
 * an edge labelled with an index when they hold the same indices and differ only
 * in the value at that index. A node together with its neighbours along one label
 * forms a clique; a clique that covers the whole domain at that label is
 * contracted into the node without the label. Nodes that contain a shorter node
 * are removed. Contraction and removal run in rounds until the graph is stable,
 * which gives the same result as {@link SetReducer}.
 */
public class DeltaGraph implements WitnessReducer {

    private static final Logger logger = LoggerFactory.getLogger(DeltaGraph.class);

    /**
     * Length to node to neighbour to label.
     */
    private final Map<Integer, Map<List<Delta>, Map<List<Delta>, Integer>>> nodes = new TreeMap<>();

    @Override
    public Set<List<Delta>> minimize(List<Integer> domain, Collection<List<Delta>> witnesses) {
        DeltaGraph graph = new DeltaGraph();
        WitnessReducer.subsume(witnesses).forEach(graph::insert);
        while (true) {
            Set<List<Delta>> contracted = graph.contractions(domain);
            Set<List<Delta>> before = graph.nodes();
            contracted.forEach(graph::insert);
            graph.removeSupersets();
            if (graph.nodes().equals(before)) {
                logger.debug("Delta graph stable with {} nodes", before.size());
                return before;
            }
        }
    }

    /**
     * Insert a node and connect it to every node of the same length it differs
     * from at exactly one index.
     */
    public void insert(List<Delta> node) {
        Map<List<Delta>, Map<List<Delta>, Integer>> level =
                nodes.computeIfAbsent(node.size(), k -> new LinkedHashMap<>());
        if (level.containsKey(node)) {
            return;
        }
        level.put(node, new LinkedHashMap<>());
        for (Map.Entry<List<Delta>, Map<List<Delta>, Integer>> other : level.entrySet()) {
            int label = label(node, other.getKey());
            if (label >= 0) {
                level.get(node).put(other.getKey(), label);
                other.getValue().put(node, label);
            }
        }
    }

    public Set<List<Delta>> nodes() {
        Set<List<Delta>> all = new LinkedHashSet<>();
        nodes.values().forEach(level -> all.addAll(level.keySet()));
        return all;
    }

    /**
     * Neighbours of a node along one label.
     */
    public Set<List<Delta>> neighbours(List<Delta> node, int label) {
        Map<List<Delta>, Integer> edges = nodes.getOrDefault(node.size(), Map.of()).get(node);
        Set<List<Delta>> result = new LinkedHashSet<>();
        if (edges != null) {
            edges.forEach((n, l) -> {
                if (l == label) {
                    result.add(n);
                }
            });
        }
        return result;
    }

    /**
     * The index at which two equally long nodes differ, or -1 when they are equal,
     * hold different indices, or differ in more than one value.
     */
    static int label(List<Delta> a, List<Delta> b) {
        if (a.size() != b.size()) {
            return -1;
        }
        int label = -1;
        for (int k = 0; k < a.size(); k++) {
            Delta x = a.get(k);
            Delta y = b.get(k);
            if (x.index() != y.index()) {
                return -1;
            }
            if (x.value() != y.value()) {
                if (label >= 0) {
                    return -1;
                }
                label = x.index();
            }
        }
        return label;
    }

    private Set<List<Delta>> contractions(List<Integer> domain) {
        Set<List<Delta>> result = new LinkedHashSet<>();
        for (Map<List<Delta>, Map<List<Delta>, Integer>> level : nodes.values()) {
            for (Map.Entry<List<Delta>, Map<List<Delta>, Integer>> entry : level.entrySet()) {
                List<Delta> node = entry.getKey();
                for (int label : new HashSet<>(entry.getValue().values())) {
                    int position = positionOf(node, label);
                    Set<Integer> values = new HashSet<>();
                    values.add(node.get(position).value());
                    for (List<Delta> neighbour : neighbours(node, label)) {
                        values.add(neighbour.get(position).value());
                    }
                    if (values.containsAll(domain)) {
                        result.add(WitnessReducer.without(node, position));
                    }
                }
                // a single node covers the domain on its own when the domain has one value
                for (int position = 0; position < node.size(); position++) {
                    if (domain.size() == 1 && domain.contains(node.get(position).value())) {
                        result.add(WitnessReducer.without(node, position));
                    }
                }
            }
        }
        return result;
    }

    private void removeSupersets() {
        Set<List<Delta>> keep = WitnessReducer.subsume(nodes());
        List<List<Delta>> removed = new ArrayList<>(nodes());
        removed.removeAll(keep);
        for (List<Delta> node : removed) {
            Map<List<Delta>, Map<List<Delta>, Integer>> level = nodes.get(node.size());
            Map<List<Delta>, Integer> edges = level.remove(node);
            for (List<Delta> neighbour : edges.keySet()) {
                Map<List<Delta>, Integer> back = level.get(neighbour);
                if (back != null) {
                    back.remove(node);
                }
            }
            if (level.isEmpty()) {
                nodes.remove(node.size());
            }
        }
    }

    private static int positionOf(List<Delta> node, int index) {
        for (int k = 0; k < node.size(); k++) {
            if (node.get(k).index() == index) {
                return k;
            }
        }
        throw new IllegalStateException("Index " + index + " not found in " + node);
    }
}
