package com.e2eq.causal.check;

import com.e2eq.causal.core.SignedNode;

/** Direction a statement claims the subject pushes the object in. */
public enum QueryPolarity {
    INCREASE(SignedNode.POSITIVE),
    DECREASE(SignedNode.NEGATIVE);

    private final int targetPolarity;

    QueryPolarity(int targetPolarity) {
        this.targetPolarity = targetPolarity;
    }

    /** Polarity of the signed target node a realizing path must end at. */
    public int targetPolarity() {
        return targetPolarity;
    }
}
