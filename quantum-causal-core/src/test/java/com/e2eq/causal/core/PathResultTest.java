package com.e2eq.causal.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PathResultTest {

    @Test
    void refusesMorePathsThanMaxPaths() {
        PathResult r = PathResult.of(ResultCode.PATHS_FOUND, 1, 5);
        r.addPath(Path.of(SignedNode.positive("A"), SignedNode.positive("B")));
        assertTrue(r.isFull());
        assertThrows(IllegalStateException.class,
                () -> r.addPath(Path.of(SignedNode.positive("A"), SignedNode.positive("C"))));
        assertEquals(1, r.getPaths().size());
    }

    @Test
    void viewsAreReadOnly() {
        PathResult r = PathResult.of(ResultCode.NO_PATHS_FOUND, 1, 5);
        assertFalse(r.isPathFound());
        assertThrows(UnsupportedOperationException.class,
                () -> r.getPathMetrics().add(new PathMetric(SignedNode.positive("A"), SignedNode.positive("B"), 1)));
    }

    @Test
    void rejectsNegativeLimits() {
        assertThrows(IllegalArgumentException.class, () -> PathResult.of(ResultCode.PATHS_FOUND, -1, 5));
        assertThrows(IllegalArgumentException.class, () -> PathResult.of(ResultCode.PATHS_FOUND, 1, -1));
    }

    @Test
    void toStringListsMetricsAndPaths() {
        PathResult r = PathResult.of(ResultCode.PATHS_FOUND, 2, 5);
        r.addMetric(new PathMetric(SignedNode.positive("A"), SignedNode.negative("C"), 2));
        r.addPath(Path.of(SignedNode.positive("A"), SignedNode.positive("B"), SignedNode.negative("C")));
        String s = r.toString();
        assertTrue(s.contains("resultCode=PATHS_FOUND"), s);
        assertTrue(s.contains("(A, 0) -> (C, 1) (2)"), s);
        assertTrue(s.contains("(A, 0) -> (B, 0) -> (C, 1)"), s);
    }
}
