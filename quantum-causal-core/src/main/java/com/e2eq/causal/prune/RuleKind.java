package com.e2eq.causal.prune;

import java.util.Locale;

/** Coarse classification of a model rule, as far as contradiction pruning cares. */
public enum RuleKind {
    INCREASE_AMOUNT,
    DECREASE_AMOUNT,
    BINDING,
    MODIFICATION,
    ACTIVATION,
    OTHER;

    public static RuleKind parse(String value) {
        if (value == null || value.isBlank()) return OTHER;
        String norm = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return RuleKind.valueOf(norm);
        } catch (IllegalArgumentException iae) {
            throw new IllegalArgumentException("Unknown rule kind '" + value + "'. Expected one of: "
                    + java.util.Arrays.toString(values()));
        }
    }
}
