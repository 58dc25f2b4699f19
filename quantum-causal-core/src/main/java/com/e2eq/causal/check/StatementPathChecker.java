package com.e2eq.causal.check;

import com.e2eq.causal.check.QueryAdapter.SourceResolution;
import com.e2eq.causal.check.QueryAdapter.StatementResolution;
import com.e2eq.causal.core.*;
import com.e2eq.causal.exceptions.QueryAdapterException;
import org.jboss.logging.Logger;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Decides, for each statement, whether the signed graph holds a path realizing it.
 * <p>
 * A check resolves the statement through the {@link QueryAdapter}, then walks the
 * product of subject candidates and target nodes. For each pair the subject is
 * resolved to source nodes, a reachability search runs backwards from the target and,
 * when sources are in reach, up to {@code maxPaths} concrete paths are enumerated.
 * </p>
 * <p>
 * Domain outcomes are reported as {@link ResultCode}s on the returned {@link PathResult}.
 * The checker only reads the graph, so one instance can serve concurrent checks.
 * </p>
 *
 * @param <S> subject candidate type of the adapter
 */
public class StatementPathChecker<S> {

    private static final Logger LOG = Logger.getLogger(StatementPathChecker.class);

    public static final int DEFAULT_MAX_PATHS = 1;
    public static final int DEFAULT_MAX_PATH_LENGTH = 5;

    private final SignedGraph graph;
    private final QueryAdapter<S> adapter;
    private final ReachabilityFinder finder;
    private final PathEnumerator enumerator;
    private final int defaultMaxPaths;
    private final int defaultMaxPathLength;
    private final List<CausalQuery> statements = new ArrayList<>();

    public StatementPathChecker(SignedGraph graph, QueryAdapter<S> adapter) {
        this(graph, adapter, DEFAULT_MAX_PATHS, DEFAULT_MAX_PATH_LENGTH);
    }

    /** Uses the given limits wherever a call does not pass its own. */
    public StatementPathChecker(SignedGraph graph, QueryAdapter<S> adapter, int maxPaths, int maxPathLength) {
        this(graph, adapter, new ReachabilityFinder(), new PathEnumerator(), maxPaths, maxPathLength);
    }

    public StatementPathChecker(SignedGraph graph, QueryAdapter<S> adapter,
                                ReachabilityFinder finder, PathEnumerator enumerator) {
        this(graph, adapter, finder, enumerator, DEFAULT_MAX_PATHS, DEFAULT_MAX_PATH_LENGTH);
    }

    public StatementPathChecker(SignedGraph graph, QueryAdapter<S> adapter,
                                ReachabilityFinder finder, PathEnumerator enumerator,
                                int maxPaths, int maxPathLength) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.finder = Objects.requireNonNull(finder, "finder");
        this.enumerator = Objects.requireNonNull(enumerator, "enumerator");
        requireLimits(maxPaths, maxPathLength);
        this.defaultMaxPaths = maxPaths;
        this.defaultMaxPathLength = maxPathLength;
    }

    public SignedGraph getGraph() {
        return graph;
    }

    public int getDefaultMaxPaths() {
        return defaultMaxPaths;
    }

    public int getDefaultMaxPathLength() {
        return defaultMaxPathLength;
    }

    public void addStatements(Collection<CausalQuery> queries) {
        statements.addAll(queries);
    }

    public List<CausalQuery> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    /** Checks the statements added through {@link #addStatements(Collection)}. */
    public List<CheckedQuery> checkModel(int maxPaths, int maxPathLength) {
        return checkModel(statements, maxPaths, maxPathLength);
    }

    public List<CheckedQuery> checkModel() {
        return checkModel(defaultMaxPaths, defaultMaxPathLength);
    }

    /**
     * Checks every query in order. A query that fails with an exception is logged and
     * reported as a false result; the remaining queries are still checked.
     */
    public List<CheckedQuery> checkModel(List<CausalQuery> queries, int maxPaths, int maxPathLength) {
        requireLimits(maxPaths, maxPathLength);
        List<CheckedQuery> results = new ArrayList<>(queries.size());
        for (int i = 0; i < queries.size(); i++) {
            CausalQuery q = queries.get(i);
            LOG.infof("Checking statement (%d/%d): %s", i + 1, queries.size(), q);
            results.add(new CheckedQuery(q, checkIsolated(q, maxPaths, maxPathLength)));
        }
        return results;
    }

    /**
     * Same as {@link #checkModel(List, int, int)} but checks queries concurrently on the
     * given executor. Results keep the order of the input.
     */
    public List<CheckedQuery> checkModel(List<CausalQuery> queries, int maxPaths, int maxPathLength,
                                         ExecutorService executor) {
        requireLimits(maxPaths, maxPathLength);
        Objects.requireNonNull(executor, "executor");
        List<CompletableFuture<CheckedQuery>> futures = new ArrayList<>(queries.size());
        int total = queries.size();
        for (int i = 0; i < total; i++) {
            CausalQuery q = queries.get(i);
            int idx = i + 1;
            futures.add(CompletableFuture.supplyAsync(() -> {
                LOG.infof("Checking statement (%d/%d): %s", idx, total, q);
                return new CheckedQuery(q, checkIsolated(q, maxPaths, maxPathLength));
            }, executor));
        }
        List<CheckedQuery> results = new ArrayList<>(total);
        for (CompletableFuture<CheckedQuery> f : futures) {
            results.add(f.join());
        }
        return results;
    }

    private PathResult checkIsolated(CausalQuery q, int maxPaths, int maxPathLength) {
        try {
            return checkStatement(q, maxPaths, maxPathLength);
        } catch (QueryAdapterException e) {
            LOG.errorf(e, "Query adapter failed while checking %s", q);
            return PathResult.of(ResultCode.STATEMENT_TYPE_NOT_HANDLED, maxPaths, maxPathLength);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Unexpected failure while checking %s", q);
            return PathResult.of(ResultCode.NO_PATHS_FOUND, maxPaths, maxPathLength);
        }
    }

    public PathResult checkStatement(CausalQuery query) {
        return checkStatement(query, defaultMaxPaths, defaultMaxPathLength);
    }

    /**
     * Checks one statement. Returns on the first subject/target pair that finds paths (or
     * would, were {@code maxPaths} not zero). A pair whose shortest path is too long is
     * only reported if no other pair does better.
     */
    public PathResult checkStatement(CausalQuery query, int maxPaths, int maxPathLength) {
        Objects.requireNonNull(query, "query");
        requireLimits(maxPaths, maxPathLength);
        StatementCheck check = new StatementCheck(query);

        StatementResolution<S> resolution = adapter.resolveStatement(query);
        if (resolution == null) {
            throw new QueryAdapterException(query, "resolveStatement returned null");
        }
        if (resolution.isError()) {
            if (resolution.error().pathFound()) {
                throw new QueryAdapterException(query, "resolveStatement reported " + resolution.error() + " as an error");
            }
            check.moveTo(CheckPhase.TERMINAL);
            return PathResult.of(resolution.error(), maxPaths, maxPathLength);
        }
        if (resolution.subjects().isEmpty() || resolution.targets().isEmpty()) {
            throw new QueryAdapterException(query, "resolveStatement returned neither an error nor candidates");
        }

        PathResult tooLong = null;
        for (S subject : resolution.subjects()) {
            for (SignedNode target : resolution.targets()) {
                PathResult r = findPaths(check, subject, target, maxPaths, maxPathLength);
                if (r.getResultCode() == ResultCode.PATHS_FOUND || r.getResultCode() == ResultCode.MAX_PATHS_ZERO) {
                    check.moveTo(CheckPhase.TERMINAL);
                    return r;
                }
                if (r.getResultCode() == ResultCode.MAX_PATH_LENGTH_EXCEEDED && tooLong == null) {
                    tooLong = r;
                }
            }
        }
        check.moveTo(CheckPhase.TERMINAL);
        return tooLong != null ? tooLong : PathResult.of(ResultCode.NO_PATHS_FOUND, maxPaths, maxPathLength);
    }

    /** Finds paths from one subject candidate to one signed target. */
    public PathResult findPaths(S subject, SignedNode target, int maxPaths, int maxPathLength) {
        requireLimits(maxPaths, maxPathLength);
        return findPaths(null, subject, target, maxPaths, maxPathLength);
    }

    private PathResult findPaths(StatementCheck check, S subject, SignedNode target, int maxPaths, int maxPathLength) {
        SourceResolution sources = adapter.resolveSubjectToSources(subject);
        if (sources == null) {
            throw new QueryAdapterException("resolveSubjectToSources returned null for " + subject);
        }
        if (sources.isError()) {
            if (sources.error().pathFound()) {
                throw new QueryAdapterException("resolveSubjectToSources reported " + sources.error() + " as an error");
            }
            LOG.debugf("No sources for subject %s: %s", subject, sources.error());
            return PathResult.of(sources.error(), maxPaths, maxPathLength);
        }
        if (check != null) check.moveTo(CheckPhase.SOURCES_RESOLVED);
        PathResult result = search(sources.sources(), target, maxPaths, maxPathLength);
        if (check != null) check.moveTo(CheckPhase.SEARCH_DONE);
        return result;
    }

    private PathResult search(Set<SignedNode> sources, SignedNode target, int maxPaths, int maxPathLength) {
        List<PathMetric> metrics = new ArrayList<>();
        Set<SignedNode> found = new LinkedHashSet<>();
        int minLength = Integer.MAX_VALUE;
        for (PathMetric m : finder.findSources(graph, target, sources)) {
            metrics.add(m);
            found.add(m.sourceNode());
            minLength = Math.min(minLength, m.length());
        }

        if (metrics.isEmpty()) {
            return PathResult.of(ResultCode.NO_PATHS_FOUND, maxPaths, maxPathLength);
        }
        ResultCode code;
        if (maxPaths == 0) {
            code = ResultCode.MAX_PATHS_ZERO;
        } else if (minLength > maxPathLength) {
            code = ResultCode.MAX_PATH_LENGTH_EXCEEDED;
        } else {
            code = ResultCode.PATHS_FOUND;
        }
        PathResult result = PathResult.of(code, maxPaths, maxPathLength);
        metrics.forEach(result::addMetric);
        if (code != ResultCode.PATHS_FOUND) {
            LOG.debugf("%s for target %s (shortest %d, %d sources)", code, target, minLength, found.size());
            return result;
        }

        for (SignedNode source : found) {
            if (result.isFull()) break;
            Iterator<Path> it = enumerator.enumerate(graph, source, target);
            while (!result.isFull() && it.hasNext()) {
                Path p = it.next();
                // paths come shortest first, so the first one over the limit ends this source
                if (!p.closedLoop() && p.length() > maxPathLength) break;
                result.addPath(p);
            }
        }
        LOG.debugf("Found %d path(s) to %s from %d source(s)", (Object) result.getPaths().size(), target, found.size());
        return result;
    }

    private static void requireLimits(int maxPaths, int maxPathLength) {
        if (maxPaths < 0) throw new IllegalArgumentException("maxPaths must be >= 0, got " + maxPaths);
        if (maxPathLength < 0) throw new IllegalArgumentException("maxPathLength must be >= 0, got " + maxPathLength);
    }
}
