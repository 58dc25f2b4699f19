package com.e2eq.causal.core;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An ordered walk through a {@link SignedGraph}. Length is the number of edges.
 * A closed loop starts and ends at the same node and comes from a feedback query
 * where subject and object coincide.
 */
public record Path(List<SignedNode> nodes, boolean closedLoop) {

    public Path {
        nodes = List.copyOf(nodes);
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("Path must contain at least one node");
        }
    }

    public static Path of(List<SignedNode> nodes) {
        return new Path(nodes, false);
    }

    public static Path of(SignedNode... nodes) {
        return new Path(List.of(nodes), false);
    }

    public int length() {
        return nodes.size() - 1;
    }

    public SignedNode source() {
        return nodes.get(0);
    }

    public SignedNode target() {
        return nodes.get(nodes.size() - 1);
    }

    @Override
    public String toString() {
        return nodes.stream().map(SignedNode::toString).collect(Collectors.joining(" -> "));
    }
}
