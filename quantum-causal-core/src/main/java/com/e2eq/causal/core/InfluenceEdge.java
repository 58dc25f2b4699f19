package com.e2eq.causal.core;

import java.util.Objects;

/**
 * A raw influence-map edge. The sign is the untouched attribute value and is only
 * interpreted through an {@link EdgeSignConvention}; it may be null in malformed input.
 */
public record InfluenceEdge(String source, String target, Integer sign) {
    public InfluenceEdge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
    }

    public boolean isSelfLoop() {
        return source.equals(target);
    }
}
