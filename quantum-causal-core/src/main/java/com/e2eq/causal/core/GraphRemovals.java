package com.e2eq.causal.core;

import java.util.Set;

/** Nodes and edges to drop from an {@link InfluenceGraph} in one batch. */
public record GraphRemovals(Set<String> nodes, Set<InfluenceEdge> edges) {
    public GraphRemovals {
        nodes = nodes == null ? Set.of() : Set.copyOf(nodes);
        edges = edges == null ? Set.of() : Set.copyOf(edges);
    }

    public static GraphRemovals empty() {
        return new GraphRemovals(Set.of(), Set.of());
    }

    public static GraphRemovals ofNodes(Set<String> nodes) {
        return new GraphRemovals(nodes, Set.of());
    }

    public static GraphRemovals ofEdges(Set<InfluenceEdge> edges) {
        return new GraphRemovals(Set.of(), edges);
    }

    public boolean isEmpty() {
        return nodes.isEmpty() && edges.isEmpty();
    }

    public int size() {
        return nodes.size() + edges.size();
    }
}
