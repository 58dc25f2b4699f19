package com.e2eq.causal.core;

/** A source reaching a target in {@code length} steps, as found by {@link ReachabilityFinder}. */
public record PathMetric(SignedNode sourceNode, SignedNode targetNode, int length) {
}
