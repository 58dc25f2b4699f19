package com.e2eq.causal.core;

import java.util.Objects;

/**
 * A base node paired with a polarity: {@code 0} for the activated sense of the node,
 * {@code 1} for its inhibited sense.
 */
public record SignedNode(String node, int polarity) {

    public static final int POSITIVE = 0;
    public static final int NEGATIVE = 1;

    public SignedNode {
        Objects.requireNonNull(node, "node");
        if (polarity != POSITIVE && polarity != NEGATIVE) {
            throw new IllegalArgumentException("Polarity must be 0 or 1, got " + polarity + " for " + node);
        }
    }

    public static SignedNode positive(String node) {
        return new SignedNode(node, POSITIVE);
    }

    public static SignedNode negative(String node) {
        return new SignedNode(node, NEGATIVE);
    }

    public boolean isPositive() {
        return polarity == POSITIVE;
    }

    /** +1 for the positive sense, -1 for the negative one. */
    public int sign() {
        return polarity == POSITIVE ? 1 : -1;
    }

    public SignedNode flip() {
        return new SignedNode(node, 1 - polarity);
    }

    /** Follows an edge of the given sign: positive edges keep polarity, negative edges flip it. */
    public SignedNode through(EdgeSign edgeSign) {
        return edgeSign == EdgeSign.POSITIVE ? this : flip();
    }

    @Override
    public String toString() {
        return "(" + node + ", " + polarity + ")";
    }
}
