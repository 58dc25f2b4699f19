package com.e2eq.causal.core;

import org.jboss.logging.Logger;
import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

import java.util.*;

/**
 * Turns an influence multigraph with signed edges into a {@link SignedGraph}
 * whose edges preserve polarity.
 * <p>
 * Every base node {@code n} becomes {@code (n,0)} and {@code (n,1)}. A positive edge
 * {@code u -> v} yields {@code (u,0)->(v,0)} and {@code (u,1)->(v,1)}; a negative edge
 * yields {@code (u,0)->(v,1)} and {@code (u,1)->(v,0)}. Following a path therefore
 * composes edge signs, and a path ends at polarity {@code p} exactly when the product
 * of its edge signs is {@code +1} for {@code p = 0} and {@code -1} for {@code p = 1}.
 * </p>
 * <p>
 * Parallel edges between the same ordered pair are collapsed to one sign. When they
 * disagree the sign resolves to positive and a warning is logged.
 * </p>
 */
public class SignedGraphBuilder {

    private static final Logger LOG = Logger.getLogger(SignedGraphBuilder.class);

    public SignedGraph build(InfluenceGraph raw, EdgeSignConvention convention) {
        return build(raw, convention, true);
    }

    public SignedGraph build(InfluenceGraph raw, EdgeSignConvention convention, boolean pruneDanglingNegatives) {
        Objects.requireNonNull(raw, "raw graph");
        Objects.requireNonNull(convention, "sign convention");

        Graph<SignedNode, DefaultEdge> g = new DefaultDirectedGraph<>(DefaultEdge.class);
        for (String n : raw.nodes()) {
            g.addVertex(SignedNode.positive(n));
            g.addVertex(SignedNode.negative(n));
        }

        Map<List<String>, EdgeSign> resolved = resolveSigns(raw, convention);
        for (Map.Entry<List<String>, EdgeSign> e : resolved.entrySet()) {
            String u = e.getKey().get(0);
            String v = e.getKey().get(1);
            for (SignedNode from : List.of(SignedNode.positive(u), SignedNode.negative(u))) {
                g.addEdge(from, new SignedNode(v, from.polarity()).through(e.getValue()));
            }
        }

        int pruned = pruneDanglingNegatives ? pruneDanglingNegatives(g) : 0;
        LOG.debugf("Built signed graph: %d nodes, %d edges from %d base nodes (%d dangling negative nodes pruned)",
                g.vertexSet().size(), g.edgeSet().size(), raw.nodeCount(), pruned);
        return new SignedGraph(g);
    }

    /**
     * Builds a graph that ignores edge signs: every edge is positive and only the
     * positive sense of each node exists. Used for reachability-only checks.
     */
    public SignedGraph buildUnsigned(InfluenceGraph raw) {
        Objects.requireNonNull(raw, "raw graph");
        Graph<SignedNode, DefaultEdge> g = new DefaultDirectedGraph<>(DefaultEdge.class);
        for (String n : raw.nodes()) {
            g.addVertex(SignedNode.positive(n));
        }
        for (InfluenceEdge e : raw.edges()) {
            g.addEdge(SignedNode.positive(e.source()), SignedNode.positive(e.target()));
        }
        LOG.debugf("Built unsigned graph: %d nodes, %d edges", g.vertexSet().size(), g.edgeSet().size());
        return new SignedGraph(g);
    }

    /**
     * One sign per ordered pair, in edge insertion order.
     */
    static Map<List<String>, EdgeSign> resolveSigns(InfluenceGraph raw, EdgeSignConvention convention) {
        Map<List<String>, EnumSet<EdgeSign>> seen = new LinkedHashMap<>();
        for (InfluenceEdge e : raw.edges()) {
            EdgeSign sign = convention.decode(e);
            seen.computeIfAbsent(List.of(e.source(), e.target()), k -> EnumSet.noneOf(EdgeSign.class)).add(sign);
        }
        Map<List<String>, EdgeSign> out = new LinkedHashMap<>();
        for (Map.Entry<List<String>, EnumSet<EdgeSign>> e : seen.entrySet()) {
            EnumSet<EdgeSign> signs = e.getValue();
            if (signs.size() > 1) {
                LOG.warnf("Conflicting signs on parallel edges %s -> %s, resolving to positive",
                        e.getKey().get(0), e.getKey().get(1));
                out.put(e.getKey(), EdgeSign.POSITIVE);
            } else {
                out.put(e.getKey(), signs.iterator().next());
            }
        }
        return out;
    }

    /**
     * Removes negative nodes without predecessors until none are left. Removing one can
     * leave a successor without predecessors, so successors are re-examined.
     */
    private static int pruneDanglingNegatives(Graph<SignedNode, DefaultEdge> g) {
        Deque<SignedNode> dq = new ArrayDeque<>();
        for (SignedNode n : g.vertexSet()) {
            if (!n.isPositive() && g.inDegreeOf(n) == 0) dq.add(n);
        }
        int removed = 0;
        while (!dq.isEmpty()) {
            SignedNode n = dq.poll();
            if (!g.containsVertex(n) || g.inDegreeOf(n) != 0) continue;
            List<SignedNode> succs = Graphs.successorListOf(g, n);
            g.removeVertex(n);
            removed++;
            for (SignedNode s : succs) {
                if (!s.isPositive() && g.containsVertex(s) && g.inDegreeOf(s) == 0) dq.add(s);
            }
        }
        return removed;
    }
}
