package com.e2eq.causal.core;

import java.util.*;

/**
 * Breadth-first search backwards from a target over predecessor edges, reporting the
 * positive-polarity sources that can reach it together with the hop count.
 * <p>
 * Every source is reported once, at its shortest distance, so each hit is witnessed by a
 * simple path of exactly that length. The target is the exception: it is reported each
 * time a visited node closes a feedback loop back onto it, except through a direct
 * self-edge, which is not a loop.
 * </p>
 */
public class ReachabilityFinder {

    /**
     * Lazily searches for sources. Each call to {@code iterator()} starts a fresh search.
     *
     * @param candidates allowed sources, or null to accept any positive node
     */
    public Iterable<PathMetric> findSources(SignedGraph graph, SignedNode target, Set<SignedNode> candidates) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(target, "target");
        return () -> new SourceSearch(graph, target, candidates);
    }

    /** Runs the search eagerly, stopping after {@code limit} hits. */
    public List<PathMetric> collect(SignedGraph graph, SignedNode target, Set<SignedNode> candidates, int limit) {
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
        List<PathMetric> out = new ArrayList<>();
        Iterator<PathMetric> it = findSources(graph, target, candidates).iterator();
        while (out.size() < limit && it.hasNext()) {
            out.add(it.next());
        }
        return out;
    }

    private record Frame(SignedNode node, Iterator<SignedNode> predecessors, int distance) {}

    /** Explicit-state worklist so the search can be paused between hits. */
    private static final class SourceSearch implements Iterator<PathMetric> {
        private final SignedGraph graph;
        private final SignedNode target;
        private final Set<SignedNode> candidates;
        private final Deque<Frame> dq = new ArrayDeque<>();
        private final Set<SignedNode> visited = new HashSet<>();
        private PathMetric next;

        SourceSearch(SignedGraph graph, SignedNode target, Set<SignedNode> candidates) {
            this.graph = graph;
            this.target = target;
            this.candidates = candidates;
            if (graph.contains(target)) {
                visited.add(target);
                dq.add(new Frame(target, graph.predecessors(target).iterator(), 0));
            }
        }

        @Override
        public boolean hasNext() {
            if (next == null) next = advance();
            return next != null;
        }

        @Override
        public PathMetric next() {
            if (!hasNext()) throw new NoSuchElementException();
            PathMetric m = next;
            next = null;
            return m;
        }

        private PathMetric advance() {
            while (!dq.isEmpty()) {
                Frame head = dq.peek();
                if (!head.predecessors().hasNext()) {
                    dq.poll();
                    continue;
                }
                SignedNode child = head.predecessors().next();
                int distance = head.distance() + 1;
                if (visited.add(child)) {
                    dq.add(new Frame(child, graph.predecessors(child).iterator(), distance));
                } else if (!child.equals(target) || head.node().equals(target)) {
                    continue;
                }
                if (child.isPositive() && (candidates == null || candidates.contains(child))) {
                    return new PathMetric(child, target, distance);
                }
            }
            return null;
        }
    }
}
