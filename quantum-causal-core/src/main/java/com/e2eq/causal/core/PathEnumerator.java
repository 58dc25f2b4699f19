package com.e2eq.causal.core;

import org.jgrapht.GraphPath;
import org.jgrapht.alg.shortestpath.YenShortestPathIterator;
import org.jgrapht.graph.DefaultEdge;

import java.util.*;

/**
 * Lazily enumerates concrete simple paths in non-decreasing length order.
 * <p>
 * When source and target coincide the result is a set of closed loops: for every
 * predecessor {@code p} of the source, each simple path {@code source -> ... -> p}
 * is extended with the source again. A direct self-edge is not reported since it
 * would be a loop of length one.
 * </p>
 */
public class PathEnumerator {

    public Iterator<Path> enumerate(SignedGraph graph, SignedNode source, SignedNode target) {
        Objects.requireNonNull(graph, "graph");
        if (!graph.contains(source) || !graph.contains(target)) {
            return Collections.emptyIterator();
        }
        if (source.equals(target)) {
            return new LoopIterator(graph, source);
        }
        return new SimplePathIterator(graph, source, target, false);
    }

    /** Wraps Yen's k-shortest path iterator; simple paths only. */
    private static final class SimplePathIterator implements Iterator<Path> {
        private final YenShortestPathIterator<SignedNode, DefaultEdge> yen;
        private final SignedNode closeWith;

        SimplePathIterator(SignedGraph graph, SignedNode source, SignedNode target, boolean closeLoop) {
            this.yen = new YenShortestPathIterator<>(graph.asGraph(), source, target);
            this.closeWith = closeLoop ? source : null;
        }

        @Override
        public boolean hasNext() {
            return yen.hasNext();
        }

        @Override
        public Path next() {
            GraphPath<SignedNode, DefaultEdge> gp = yen.next();
            List<SignedNode> nodes = new ArrayList<>(gp.getVertexList());
            if (closeWith != null) {
                nodes.add(closeWith);
                return new Path(nodes, true);
            }
            return new Path(nodes, false);
        }
    }

    private static final class LoopIterator implements Iterator<Path> {
        private final SignedGraph graph;
        private final SignedNode source;
        private final Iterator<SignedNode> predecessors;
        private Iterator<Path> current = Collections.emptyIterator();

        LoopIterator(SignedGraph graph, SignedNode source) {
            this.graph = graph;
            this.source = source;
            this.predecessors = graph.predecessors(source).iterator();
        }

        @Override
        public boolean hasNext() {
            while (!current.hasNext()) {
                if (!predecessors.hasNext()) return false;
                SignedNode p = predecessors.next();
                if (p.equals(source)) continue;
                current = new SimplePathIterator(graph, source, p, true);
            }
            return true;
        }

        @Override
        public Path next() {
            if (!hasNext()) throw new NoSuchElementException();
            return current.next();
        }
    }
}
