package com.e2eq.causal.prune;

import com.e2eq.causal.core.EdgeSignConvention;
import com.e2eq.causal.core.GraphRemovals;
import com.e2eq.causal.core.InfluenceGraph;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Simplifies an influence map before signed-graph construction by removing edges
 * that cannot contribute meaningful causal paths.
 * <p>
 * Passes run in a fixed order: self loops, parameter nodes, mutual redundancy, then
 * the catalog driven subject/object and degrade/bind contradictions. Every pass
 * collects its removals first and applies them in one batch. Removing edges can make
 * new mirror pairs appear, so the whole sequence repeats until a round removes
 * nothing; pruning an already pruned graph is then a no-op.
 * </p>
 */
public class InfluenceGraphPruner {

    private static final Logger LOG = Logger.getLogger(InfluenceGraphPruner.class);

    private final PruningOptions options;
    private final EdgeSignConvention convention;

    public InfluenceGraphPruner() {
        this(PruningOptions.defaults(), EdgeSignConvention.MULTIPLIER);
    }

    public InfluenceGraphPruner(PruningOptions options, EdgeSignConvention convention) {
        this.options = Objects.requireNonNull(options, "options");
        this.convention = Objects.requireNonNull(convention, "convention");
    }

    public InfluenceGraph prune(InfluenceGraph graph, Set<String> parameterIds, RuleCatalog catalog) {
        Objects.requireNonNull(graph, "graph");
        List<PruningPass> passes = passes(parameterIds, catalog);
        int startEdges = graph.edgeCount();
        int startNodes = graph.nodeCount();

        InfluenceGraph current = graph;
        int round = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            round++;
            for (PruningPass pass : passes) {
                GraphRemovals removals = pass.apply(current);
                if (removals.isEmpty()) continue;
                LOG.infof("Pruning pass %s (round %d) removing %d nodes and %d edges",
                        pass.name(), round, removals.nodes().size(), removals.edges().size());
                if (LOG.isDebugEnabled()) {
                    removals.nodes().forEach(n -> LOG.debugf("  node %s", n));
                    removals.edges().forEach(e -> LOG.debugf("  edge %s -> %s", e.source(), e.target()));
                }
                current = current.without(removals);
                changed = true;
            }
        }
        LOG.infof("Pruned influence map in %d round(s): %d -> %d nodes, %d -> %d edges",
                round, startNodes, current.nodeCount(), startEdges, current.edgeCount());
        return current;
    }

    List<PruningPass> passes(Set<String> parameterIds, RuleCatalog catalog) {
        List<PruningPass> passes = new ArrayList<>();
        if (options.selfLoops()) passes.add(new SelfLoopPruningPass());
        if (options.parameterNodes()) passes.add(new ParameterNodePruningPass(parameterIds));
        if (options.mutualRedundancy()) passes.add(new MutualRedundancyPruningPass());
        if (options.subjectObject()) passes.add(new SubjectObjectPruningPass(catalog));
        if (options.degradeBind()) passes.add(new DegradeBindPruningPass(catalog, convention));
        return passes;
    }
}
