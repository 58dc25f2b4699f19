package com.e2eq.causal.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of checking one statement: whether a path exists, why not if it doesn't,
 * the source metrics seen during the search and up to {@code maxPaths} concrete paths.
 * Paths and metrics are appended while the result is built and read-only through the getters.
 */
public final class PathResult {

    private final boolean pathFound;
    private final ResultCode resultCode;
    private final int maxPaths;
    private final int maxPathLength;
    private final List<PathMetric> pathMetrics = new ArrayList<>();
    private final List<Path> paths = new ArrayList<>();

    public PathResult(boolean pathFound, ResultCode resultCode, int maxPaths, int maxPathLength) {
        if (resultCode == null) throw new IllegalArgumentException("resultCode is required");
        if (maxPaths < 0) throw new IllegalArgumentException("maxPaths must be >= 0, got " + maxPaths);
        if (maxPathLength < 0) throw new IllegalArgumentException("maxPathLength must be >= 0, got " + maxPathLength);
        this.pathFound = pathFound;
        this.resultCode = resultCode;
        this.maxPaths = maxPaths;
        this.maxPathLength = maxPathLength;
    }

    public static PathResult of(ResultCode code, int maxPaths, int maxPathLength) {
        return new PathResult(code.pathFound(), code, maxPaths, maxPathLength);
    }

    public void addPath(Path path) {
        if (paths.size() >= maxPaths) {
            throw new IllegalStateException("Result already holds maxPaths=" + maxPaths + " paths");
        }
        paths.add(path);
    }

    public void addMetric(PathMetric metric) {
        pathMetrics.add(metric);
    }

    public boolean isFull() {
        return paths.size() >= maxPaths;
    }

    public boolean isPathFound() {
        return pathFound;
    }

    public ResultCode getResultCode() {
        return resultCode;
    }

    public int getMaxPaths() {
        return maxPaths;
    }

    public int getMaxPathLength() {
        return maxPathLength;
    }

    public List<PathMetric> getPathMetrics() {
        return Collections.unmodifiableList(pathMetrics);
    }

    public List<Path> getPaths() {
        return Collections.unmodifiableList(paths);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("PathResult(\n");
        sb.append("  pathFound=").append(pathFound).append(",\n");
        sb.append("  resultCode=").append(resultCode).append(",\n");
        sb.append("  maxPaths=").append(maxPaths).append(",\n");
        sb.append("  maxPathLength=").append(maxPathLength).append(",\n");
        sb.append("  pathMetrics=[");
        if (!pathMetrics.isEmpty()) {
            sb.append('\n');
            for (PathMetric m : pathMetrics) {
                sb.append("    ").append(m.sourceNode()).append(" -> ").append(m.targetNode())
                        .append(" (").append(m.length()).append(")\n");
            }
            sb.append("  ");
        }
        sb.append("],\n  paths=[");
        if (!paths.isEmpty()) {
            sb.append('\n');
            for (Path p : paths) {
                sb.append("    ").append(p).append('\n');
            }
            sb.append("  ");
        }
        sb.append("])");
        return sb.toString();
    }
}
