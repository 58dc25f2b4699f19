package com.e2eq.causal.core;

import com.e2eq.causal.exceptions.InvalidGraphException;

/**
 * How raw integer sign attributes on influence-map edges map to {@link EdgeSign}.
 * Influence maps use multipliers (+1 / -1); signed graphs exported as polarities use 0 / 1.
 */
public enum EdgeSignConvention {
    MULTIPLIER(1, -1),
    POLARITY(0, 1);

    private final int positiveValue;
    private final int negativeValue;

    EdgeSignConvention(int positiveValue, int negativeValue) {
        this.positiveValue = positiveValue;
        this.negativeValue = negativeValue;
    }

    public int positiveValue() {
        return positiveValue;
    }

    public int negativeValue() {
        return negativeValue;
    }

    public EdgeSign decode(InfluenceEdge edge) {
        Integer raw = edge.sign();
        if (raw == null) {
            throw new InvalidGraphException(edge.source(), edge.target(), null);
        }
        if (raw == positiveValue) return EdgeSign.POSITIVE;
        if (raw == negativeValue) return EdgeSign.NEGATIVE;
        throw new InvalidGraphException(edge.source(), edge.target(), raw);
    }
}
