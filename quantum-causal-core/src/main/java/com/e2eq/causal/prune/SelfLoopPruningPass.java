package com.e2eq.causal.prune;

import com.e2eq.causal.core.GraphRemovals;
import com.e2eq.causal.core.InfluenceEdge;
import com.e2eq.causal.core.InfluenceGraph;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Removes every edge from a node to itself, parallel self edges included.
 */
public final class SelfLoopPruningPass implements PruningPass {

    @Override
    public String name() {
        return "self-loops";
    }

    @Override
    public GraphRemovals apply(InfluenceGraph graph) {
        Set<InfluenceEdge> loops = new LinkedHashSet<>();
        for (InfluenceEdge e : graph.edges()) {
            if (e.isSelfLoop()) loops.add(e);
        }
        return GraphRemovals.ofEdges(loops);
    }
}
