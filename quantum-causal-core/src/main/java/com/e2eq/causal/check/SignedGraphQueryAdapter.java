package com.e2eq.causal.check;

import com.e2eq.causal.core.ResultCode;
import com.e2eq.causal.core.SignedGraph;
import com.e2eq.causal.core.SignedNode;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Adapter for graphs whose nodes are the agents themselves: subject and object are
 * node ids. A decrease targets the negative sense of the object, anything else its
 * positive sense. With {@code ignorePolarity} every target is positive, which suits
 * graphs built without signs.
 */
public class SignedGraphQueryAdapter implements QueryAdapter<String> {

    private final SignedGraph graph;
    private final boolean ignorePolarity;

    public SignedGraphQueryAdapter(SignedGraph graph) {
        this(graph, false);
    }

    public SignedGraphQueryAdapter(SignedGraph graph, boolean ignorePolarity) {
        this.graph = graph;
        this.ignorePolarity = ignorePolarity;
    }

    public static SignedGraphQueryAdapter unsigned(SignedGraph graph) {
        return new SignedGraphQueryAdapter(graph, true);
    }

    @Override
    public StatementResolution<String> resolveStatement(CausalQuery query) {
        if (CausalQueryKind.parse(query.statementKind()).isEmpty()) {
            return StatementResolution.failed(ResultCode.STATEMENT_TYPE_NOT_HANDLED);
        }
        if (query.subject() != null && !graph.contains(SignedNode.positive(query.subject()))) {
            return StatementResolution.failed(ResultCode.SUBJECT_MONOMERS_NOT_FOUND);
        }
        if (query.object() == null || !graph.contains(SignedNode.positive(query.object()))) {
            return StatementResolution.failed(ResultCode.OBSERVABLES_NOT_FOUND);
        }
        int polarity = ignorePolarity ? SignedNode.POSITIVE : query.polarity().targetPolarity();
        SignedNode target = new SignedNode(query.object(), polarity);
        return StatementResolution.of(Collections.singletonList(query.subject()), List.of(target));
    }

    @Override
    public SourceResolution resolveSubjectToSources(String subject) {
        if (subject == null) {
            return SourceResolution.anySource();
        }
        SignedNode source = SignedNode.positive(subject);
        if (!graph.contains(source)) {
            return SourceResolution.failed(ResultCode.INPUT_RULES_NOT_FOUND);
        }
        return SourceResolution.of(Set.of(source));
    }
}
