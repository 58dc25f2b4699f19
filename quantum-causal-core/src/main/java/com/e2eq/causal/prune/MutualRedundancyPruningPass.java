package com.e2eq.causal.prune;

import com.e2eq.causal.core.GraphRemovals;
import com.e2eq.causal.core.InfluenceEdge;
import com.e2eq.causal.core.InfluenceGraph;

import java.util.*;

/**
 * Removes mirror edge pairs between nodes whose successor sets agree except for each
 * other: {@code succ(p1) \ succ(p2) == {p2}} and {@code succ(p2) \ succ(p1) == {p1}}.
 * Such pairs only ever create two-node cycles that add nothing to reachability.
 * <p>
 * Qualifying nodes always have successor sets of equal size, so candidates are
 * grouped by size before the pairwise comparison.
 * </p>
 */
public final class MutualRedundancyPruningPass implements PruningPass {

    @Override
    public String name() {
        return "mutual-redundancy";
    }

    @Override
    public GraphRemovals apply(InfluenceGraph graph) {
        Set<InfluenceEdge> edges = new LinkedHashSet<>();
        for (List<String> pair : findMirrorPairs(graph, true)) {
            String p1 = pair.get(0);
            String p2 = pair.get(1);
            edges.addAll(graph.edgesBetween(p1, p2));
            edges.addAll(graph.edgesBetween(p2, p1));
        }
        return GraphRemovals.ofEdges(edges);
    }

    /**
     * Unordered mirror pairs, each as a two-element list in node order.
     *
     * @param groupBySize compare only nodes with successor sets of the same size
     */
    static Set<List<String>> findMirrorPairs(InfluenceGraph graph, boolean groupBySize) {
        Map<String, Set<String>> succ = new LinkedHashMap<>();
        for (String n : graph.nodes()) {
            succ.put(n, graph.successors(n));
        }

        Collection<List<String>> groups;
        if (groupBySize) {
            Map<Integer, List<String>> bySize = new TreeMap<>();
            succ.forEach((n, s) -> bySize.computeIfAbsent(s.size(), k -> new ArrayList<>()).add(n));
            groups = bySize.values();
        } else {
            groups = List.of(new ArrayList<>(succ.keySet()));
        }

        Set<List<String>> pairs = new LinkedHashSet<>();
        for (List<String> group : groups) {
            for (int i = 0; i < group.size(); i++) {
                for (int j = i + 1; j < group.size(); j++) {
                    String p1 = group.get(i);
                    String p2 = group.get(j);
                    if (differenceIs(succ.get(p1), succ.get(p2), p2) && differenceIs(succ.get(p2), succ.get(p1), p1)) {
                        pairs.add(List.of(p1, p2));
                    }
                }
            }
        }
        return pairs;
    }

    private static boolean differenceIs(Set<String> a, Set<String> b, String expected) {
        if (!a.contains(expected) || b.contains(expected)) return false;
        for (String x : a) {
            if (!x.equals(expected) && !b.contains(x)) return false;
        }
        return true;
    }
}
