package com.e2eq.causal.prune;

import com.e2eq.causal.core.GraphRemovals;
import com.e2eq.causal.core.InfluenceGraph;
import com.e2eq.causal.core.NodeType;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Drops model parameter nodes: those named in the supplied id set and those typed
 * {@link NodeType#PARAMETER}. Ids that are not in the graph are ignored.
 */
public final class ParameterNodePruningPass implements PruningPass {

    private final Set<String> parameterIds;

    public ParameterNodePruningPass(Set<String> parameterIds) {
        this.parameterIds = parameterIds == null ? Set.of() : Set.copyOf(parameterIds);
    }

    @Override
    public String name() {
        return "parameter-nodes";
    }

    @Override
    public GraphRemovals apply(InfluenceGraph graph) {
        Set<String> nodes = new LinkedHashSet<>();
        for (String n : graph.nodes()) {
            if (parameterIds.contains(n) || graph.typeOf(n) == NodeType.PARAMETER) nodes.add(n);
        }
        return GraphRemovals.ofNodes(nodes);
    }
}
