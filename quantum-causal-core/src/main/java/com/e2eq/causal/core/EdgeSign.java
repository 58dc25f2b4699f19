package com.e2eq.causal.core;

public enum EdgeSign {
    POSITIVE(1),
    NEGATIVE(-1);

    private final int multiplier;

    EdgeSign(int multiplier) {
        this.multiplier = multiplier;
    }

    public int multiplier() {
        return multiplier;
    }
}
