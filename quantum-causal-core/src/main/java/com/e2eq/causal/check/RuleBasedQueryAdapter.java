package com.e2eq.causal.check;

import com.e2eq.causal.core.ResultCode;
import com.e2eq.causal.core.SignedGraph;
import com.e2eq.causal.core.SignedNode;
import com.e2eq.causal.prune.RuleCatalog;
import com.e2eq.causal.prune.RuleCatalog.RuleInfo;

import java.util.*;

/**
 * Adapter for influence maps of rule based models. Subjects are agents and start paths
 * at the rules in which they act; objects are agents read through their observables.
 */
public class RuleBasedQueryAdapter implements QueryAdapter<String> {

    private final SignedGraph graph;
    private final RuleCatalog catalog;
    private final Map<String, List<String>> agentObservables;
    private final Set<String> knownAgents = new HashSet<>();

    public RuleBasedQueryAdapter(SignedGraph graph, RuleCatalog catalog, Map<String, List<String>> agentObservables) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.agentObservables = agentObservables == null ? Map.of() : Map.copyOf(agentObservables);
        for (RuleInfo r : catalog.rules()) {
            if (r.subject() != null) knownAgents.add(r.subject());
            if (r.object() != null) knownAgents.add(r.object());
            knownAgents.addAll(r.members());
        }
    }

    @Override
    public StatementResolution<String> resolveStatement(CausalQuery query) {
        if (CausalQueryKind.parse(query.statementKind()).isEmpty()) {
            return StatementResolution.failed(ResultCode.STATEMENT_TYPE_NOT_HANDLED);
        }
        if (query.subject() != null && !knownAgents.contains(query.subject())) {
            return StatementResolution.failed(ResultCode.SUBJECT_MONOMERS_NOT_FOUND);
        }
        List<SignedNode> targets = new ArrayList<>();
        if (query.object() != null) {
            int polarity = query.polarity().targetPolarity();
            for (String obs : agentObservables.getOrDefault(query.object(), List.of())) {
                SignedNode t = new SignedNode(obs, polarity);
                if (graph.contains(SignedNode.positive(obs))) targets.add(t);
            }
        }
        if (targets.isEmpty()) {
            return StatementResolution.failed(ResultCode.OBSERVABLES_NOT_FOUND);
        }
        return StatementResolution.of(Collections.singletonList(query.subject()), targets);
    }

    @Override
    public SourceResolution resolveSubjectToSources(String agent) {
        if (agent == null) {
            return SourceResolution.anySource();
        }
        Set<SignedNode> sources = new LinkedHashSet<>();
        for (String rule : catalog.rulesWithSubject(agent)) {
            SignedNode n = SignedNode.positive(rule);
            if (graph.contains(n)) sources.add(n);
        }
        if (sources.isEmpty()) {
            return SourceResolution.failed(ResultCode.INPUT_RULES_NOT_FOUND);
        }
        return SourceResolution.of(sources);
    }
}
