package com.e2eq.causal.prune;

import com.e2eq.causal.core.GraphRemovals;
import com.e2eq.causal.core.InfluenceGraph;

/**
 * One pruning rule. A pass only inspects the graph it is given; the pruner applies
 * the returned removals in a single batch once the pass has finished.
 */
public interface PruningPass {
    String name();

    GraphRemovals apply(InfluenceGraph graph);
}
