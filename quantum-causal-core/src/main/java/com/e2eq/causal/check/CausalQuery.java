package com.e2eq.causal.check;

import java.util.Objects;

/**
 * A claim that {@code subject} affects {@code object} with the given polarity.
 * A null subject means any source will do; the statement kind is free text
 * interpreted by the query adapter.
 */
public record CausalQuery(String subject, String object, QueryPolarity polarity, String statementKind) {
    public CausalQuery {
        Objects.requireNonNull(polarity, "polarity");
    }

    public static CausalQuery increase(String subject, String object, String statementKind) {
        return new CausalQuery(subject, object, QueryPolarity.INCREASE, statementKind);
    }

    public static CausalQuery decrease(String subject, String object, String statementKind) {
        return new CausalQuery(subject, object, QueryPolarity.DECREASE, statementKind);
    }

    @Override
    public String toString() {
        return statementKind + "(" + subject + ", " + object + ", " + polarity + ")";
    }
}
