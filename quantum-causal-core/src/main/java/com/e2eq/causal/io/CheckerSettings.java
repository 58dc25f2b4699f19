package com.e2eq.causal.io;

import com.e2eq.causal.core.EdgeSignConvention;
import com.e2eq.causal.prune.PruningOptions;

/**
 * Tunables for graph construction, path search and scoring.
 */
public record CheckerSettings(int maxPaths,
                              int maxPathLength,
                              double sigma,
                              boolean lossOfFunction,
                              boolean includeFinalNode,
                              boolean pruneDanglingNegatives,
                              EdgeSignConvention signConvention,
                              PruningOptions pruning) {

    public CheckerSettings {
        if (maxPaths < 0) throw new IllegalArgumentException("maxPaths must be >= 0, got " + maxPaths);
        if (maxPathLength < 0) throw new IllegalArgumentException("maxPathLength must be >= 0, got " + maxPathLength);
        if (!(sigma > 0.0)) throw new IllegalArgumentException("sigma must be > 0, got " + sigma);
        if (signConvention == null) signConvention = EdgeSignConvention.MULTIPLIER;
        if (pruning == null) pruning = PruningOptions.defaults();
    }

    public static CheckerSettings defaults() {
        return new CheckerSettings(1, 5, 0.15, false, false, true,
                EdgeSignConvention.MULTIPLIER, PruningOptions.defaults());
    }
}
