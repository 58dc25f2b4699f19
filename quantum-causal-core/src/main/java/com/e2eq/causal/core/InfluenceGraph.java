package com.e2eq.causal.core;

import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.graph.AsUnmodifiableGraph;
import org.jgrapht.graph.DirectedPseudograph;

import java.util.*;

/**
 * Immutable directed multigraph of an executable model's influences. Self loops and
 * parallel edges are allowed; parallel edges with the same sign collapse into one.
 * Every node carries a {@link NodeType}.
 * <p>
 * Pruning never mutates an instance: {@link #without(GraphRemovals)} returns a copy.
 * </p>
 */
public final class InfluenceGraph {

    private final Graph<String, InfluenceEdge> graph;
    private final Map<String, NodeType> nodeTypes;

    private InfluenceGraph(Graph<String, InfluenceEdge> graph, Map<String, NodeType> nodeTypes) {
        this.graph = new AsUnmodifiableGraph<>(graph);
        this.nodeTypes = Collections.unmodifiableMap(nodeTypes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> nodes() {
        return graph.vertexSet();
    }

    public Set<InfluenceEdge> edges() {
        return graph.edgeSet();
    }

    public int nodeCount() {
        return graph.vertexSet().size();
    }

    public int edgeCount() {
        return graph.edgeSet().size();
    }

    public boolean containsNode(String node) {
        return graph.containsVertex(node);
    }

    public NodeType typeOf(String node) {
        return nodeTypes.get(node);
    }

    /** All parallel edges from {@code source} to {@code target}; empty when either node is absent. */
    public Set<InfluenceEdge> edgesBetween(String source, String target) {
        Set<InfluenceEdge> all = graph.getAllEdges(source, target);
        return all == null ? Set.of() : all;
    }

    public Set<InfluenceEdge> outgoingEdges(String node) {
        return graph.containsVertex(node) ? graph.outgoingEdgesOf(node) : Set.of();
    }

    /** Distinct successors of a node, in edge insertion order. */
    public Set<String> successors(String node) {
        if (!graph.containsVertex(node)) return Set.of();
        return new LinkedHashSet<>(Graphs.successorListOf(graph, node));
    }

    public Set<String> predecessors(String node) {
        if (!graph.containsVertex(node)) return Set.of();
        return new LinkedHashSet<>(Graphs.predecessorListOf(graph, node));
    }

    /** Read-only JGraphT view. */
    public Graph<String, InfluenceEdge> asGraph() {
        return graph;
    }

    public InfluenceGraph without(GraphRemovals removals) {
        if (removals == null || removals.isEmpty()) return this;
        Builder b = new Builder();
        for (String n : graph.vertexSet()) {
            if (!removals.nodes().contains(n)) {
                b.addNode(n, nodeTypes.get(n));
            }
        }
        for (InfluenceEdge e : graph.edgeSet()) {
            if (removals.edges().contains(e)) continue;
            if (removals.nodes().contains(e.source()) || removals.nodes().contains(e.target())) continue;
            b.addEdge(e);
        }
        return b.build();
    }

    @Override
    public String toString() {
        return "InfluenceGraph{nodes=" + nodeCount() + ", edges=" + edgeCount() + "}";
    }

    public static final class Builder {
        private final Graph<String, InfluenceEdge> graph = new DirectedPseudograph<>(InfluenceEdge.class);
        private final Map<String, NodeType> nodeTypes = new LinkedHashMap<>();

        private Builder() {}

        /** Adds a node, or retypes it if already present. A null type means {@link NodeType#RULE}. */
        public Builder addNode(String id, NodeType type) {
            Objects.requireNonNull(id, "node id");
            graph.addVertex(id);
            nodeTypes.put(id, type == null ? NodeType.RULE : type);
            return this;
        }

        public Builder addNode(String id) {
            return addNode(id, NodeType.RULE);
        }

        public Builder addEdge(String source, String target, Integer sign) {
            return addEdge(new InfluenceEdge(source, target, sign));
        }

        public Builder addEdge(InfluenceEdge edge) {
            if (!graph.containsVertex(edge.source())) addNode(edge.source(), NodeType.RULE);
            if (!graph.containsVertex(edge.target())) addNode(edge.target(), NodeType.RULE);
            graph.addEdge(edge.source(), edge.target(), edge);
            return this;
        }

        public InfluenceGraph build() {
            DirectedPseudograph<String, InfluenceEdge> copy = new DirectedPseudograph<>(InfluenceEdge.class);
            Graphs.addGraph(copy, graph);
            return new InfluenceGraph(copy, new LinkedHashMap<>(nodeTypes));
        }
    }
}
