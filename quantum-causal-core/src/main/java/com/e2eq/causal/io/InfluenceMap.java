package com.e2eq.causal.io;

import com.e2eq.causal.core.InfluenceGraph;
import com.e2eq.causal.prune.RuleCatalog;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything read from an influence-map file: the raw graph plus the side tables the
 * pruner and the rule based adapter need.
 */
public record InfluenceMap(InfluenceGraph graph,
                           RuleCatalog catalog,
                           Set<String> parameterIds,
                           Map<String, List<String>> agentObservables) {
}
