package com.e2eq.causal.prune;

import com.e2eq.causal.core.GraphRemovals;
import com.e2eq.causal.core.InfluenceEdge;
import com.e2eq.causal.core.InfluenceGraph;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Removes {@code r1 -> r2} when the agent r1 acts upon is known, the agent acting in
 * r2 is known, and the two differ.
 */
public final class SubjectObjectPruningPass implements PruningPass {

    private final RuleCatalog catalog;

    public SubjectObjectPruningPass(RuleCatalog catalog) {
        this.catalog = catalog == null ? RuleCatalog.empty() : catalog;
    }

    @Override
    public String name() {
        return "subject-object";
    }

    @Override
    public GraphRemovals apply(InfluenceGraph graph) {
        Set<InfluenceEdge> edges = new LinkedHashSet<>();
        for (InfluenceEdge e : graph.edges()) {
            if (e.isSelfLoop()) continue;
            Optional<String> obj = catalog.objectOf(e.source());
            Optional<String> subj = catalog.subjectOf(e.target());
            if (obj.isPresent() && subj.isPresent() && !obj.get().equals(subj.get())) {
                edges.add(e);
            }
        }
        return GraphRemovals.ofEdges(edges);
    }
}
