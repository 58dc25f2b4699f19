package com.e2eq.causal.score;

import com.e2eq.causal.core.Path;

/** A path with its log-likelihood under the observations. */
public record ScoredPath(Path path, double score) {
}
