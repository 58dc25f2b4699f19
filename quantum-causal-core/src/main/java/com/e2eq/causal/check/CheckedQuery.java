package com.e2eq.causal.check;

import com.e2eq.causal.core.PathResult;

public record CheckedQuery(CausalQuery query, PathResult result) {
}
