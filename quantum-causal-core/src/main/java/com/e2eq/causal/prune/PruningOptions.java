package com.e2eq.causal.prune;

/**
 * Which pruning passes run. Structural passes and degrade/bind pruning are on by
 * default; subject/object coherence pruning is opt-in.
 */
public record PruningOptions(boolean selfLoops,
                             boolean parameterNodes,
                             boolean mutualRedundancy,
                             boolean degradeBind,
                             boolean subjectObject) {

    public static PruningOptions defaults() {
        return new PruningOptions(true, true, true, true, false);
    }

    public static PruningOptions none() {
        return new PruningOptions(false, false, false, false, false);
    }
}
