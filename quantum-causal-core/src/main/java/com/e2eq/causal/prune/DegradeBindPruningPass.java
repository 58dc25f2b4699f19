package com.e2eq.causal.prune;

import com.e2eq.causal.core.EdgeSignConvention;
import com.e2eq.causal.core.GraphRemovals;
import com.e2eq.causal.core.InfluenceEdge;
import com.e2eq.causal.core.InfluenceGraph;
import com.e2eq.causal.prune.RuleCatalog.RuleInfo;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Removes positive edges from a rule degrading X to a binding rule that has X among
 * its members: destroying a binding partner cannot promote the binding.
 */
public final class DegradeBindPruningPass implements PruningPass {

    private final RuleCatalog catalog;
    private final EdgeSignConvention convention;

    public DegradeBindPruningPass(RuleCatalog catalog, EdgeSignConvention convention) {
        this.catalog = catalog == null ? RuleCatalog.empty() : catalog;
        this.convention = convention;
    }

    @Override
    public String name() {
        return "degrade-bind";
    }

    @Override
    public GraphRemovals apply(InfluenceGraph graph) {
        Set<InfluenceEdge> edges = new LinkedHashSet<>();
        for (InfluenceEdge e : graph.edges()) {
            if (e.sign() == null || e.sign() != convention.positiveValue()) continue;
            Optional<RuleInfo> r1 = catalog.find(e.source());
            Optional<RuleInfo> r2 = catalog.find(e.target());
            if (r1.isEmpty() || r2.isEmpty()) continue;
            if (r1.get().kind() != RuleKind.DECREASE_AMOUNT || r2.get().kind() != RuleKind.BINDING) continue;
            String degraded = r1.get().object();
            if (degraded != null && r2.get().members().contains(degraded)) {
                edges.add(e);
            }
        }
        return GraphRemovals.ofEdges(edges);
    }
}
