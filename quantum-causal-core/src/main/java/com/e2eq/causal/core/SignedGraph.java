package com.e2eq.causal.core;

import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.graph.AsUnmodifiableGraph;
import org.jgrapht.graph.DefaultEdge;

import java.util.List;
import java.util.Set;

/**
 * Read-only directed graph over {@link SignedNode}s. Built once by
 * {@link SignedGraphBuilder} and safe to share between threads afterwards.
 */
public final class SignedGraph {

    private final Graph<SignedNode, DefaultEdge> graph;

    SignedGraph(Graph<SignedNode, DefaultEdge> graph) {
        this.graph = new AsUnmodifiableGraph<>(graph);
    }

    public boolean contains(SignedNode node) {
        return graph.containsVertex(node);
    }

    public Set<SignedNode> nodes() {
        return graph.vertexSet();
    }

    public int nodeCount() {
        return graph.vertexSet().size();
    }

    public int edgeCount() {
        return graph.edgeSet().size();
    }

    public boolean hasEdge(SignedNode source, SignedNode target) {
        return graph.containsEdge(source, target);
    }

    /** Predecessors of a node; empty when the node is not in the graph. */
    public List<SignedNode> predecessors(SignedNode node) {
        if (!graph.containsVertex(node)) return List.of();
        return Graphs.predecessorListOf(graph, node);
    }

    public List<SignedNode> successors(SignedNode node) {
        if (!graph.containsVertex(node)) return List.of();
        return Graphs.successorListOf(graph, node);
    }

    public int inDegree(SignedNode node) {
        return graph.containsVertex(node) ? graph.inDegreeOf(node) : 0;
    }

    public Graph<SignedNode, DefaultEdge> asGraph() {
        return graph;
    }

    @Override
    public String toString() {
        return "SignedGraph{nodes=" + nodeCount() + ", edges=" + edgeCount() + "}";
    }
}
