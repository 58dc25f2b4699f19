package com.e2eq.causal.score;

import com.e2eq.causal.core.Path;
import com.e2eq.causal.core.SignedNode;
import com.e2eq.causal.score.ObservableIndex.ObservableRelation;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.special.Erf;
import org.jboss.logging.Logger;

import java.util.*;

/**
 * Ranks paths by how well the signs they predict agree with measured values.
 * <p>
 * Each measurement {@code x} is modelled as {@code N(x, sigma)}. A node predicting a
 * decrease (or no change) of an observable contributes {@code log P(X <= 0)}, a node
 * predicting an increase contributes {@code log P(X > 0)}. Nodes without observables
 * contribute {@code log 0.5}, the probability of a non-positive value under {@code N(0, sigma)}.
 * The last node is the query target and is skipped unless requested.
 * </p>
 * <p>
 * Tail probabilities are taken in log space, so a measurement far on the wrong side of
 * zero gives a large negative but finite term instead of {@code -Infinity}.
 * </p>
 * <p>
 * Results are ordered by score, best first; equal scores keep shorter paths first and
 * otherwise the input order.
 * </p>
 */
public class PathScorer {

    private static final Logger LOG = Logger.getLogger(PathScorer.class);

    public static final double DEFAULT_SIGMA = 0.15;

    // below this z the erfc form loses precision and the asymptotic expansion takes over
    private static final double ASYMPTOTIC_TAIL = -30.0;
    private static final double HALF_LOG_2PI = 0.5 * Math.log(2.0 * Math.PI);
    private static final double SQRT2 = Math.sqrt(2.0);

    private final ObservableIndex index;
    private final double sigma;
    private final boolean lossOfFunction;
    private final boolean includeFinalNode;

    public PathScorer(ObservableIndex index) {
        this(index, DEFAULT_SIGMA);
    }

    public PathScorer(ObservableIndex index, double sigma) {
        this(index, sigma, false, false);
    }

    /**
     * @param lossOfFunction   default for {@link #score(List, ObservationTable)}: the subject
     *                         is knocked down, so every prediction is inverted
     * @param includeFinalNode default for {@link #score(List, ObservationTable)}: also score
     *                         the query target
     */
    public PathScorer(ObservableIndex index, double sigma, boolean lossOfFunction, boolean includeFinalNode) {
        this.index = Objects.requireNonNull(index, "index");
        requireSigma(sigma);
        this.sigma = sigma;
        this.lossOfFunction = lossOfFunction;
        this.includeFinalNode = includeFinalNode;
    }

    public double getSigma() {
        return sigma;
    }

    public boolean isLossOfFunction() {
        return lossOfFunction;
    }

    public boolean isIncludeFinalNode() {
        return includeFinalNode;
    }

    public List<ScoredPath> score(List<Path> paths, ObservationTable observations) {
        return score(paths, observations, sigma, lossOfFunction, includeFinalNode);
    }

    public List<ScoredPath> score(List<Path> paths, ObservationTable observations,
                                  boolean lossOfFunction, boolean includeFinalNode) {
        return score(paths, observations, sigma, lossOfFunction, includeFinalNode);
    }

    public List<ScoredPath> score(List<Path> paths, ObservationTable observations, double sigma,
                                  boolean lossOfFunction, boolean includeFinalNode) {
        Objects.requireNonNull(paths, "paths");
        Objects.requireNonNull(observations, "observations");
        requireSigma(sigma);
        double noRelationTerm = new NormalDistribution(null, 0.0, sigma).cumulativeProbability(0.0);
        noRelationTerm = Math.log(noRelationTerm);

        List<ScoredPath> scored = new ArrayList<>(paths.size());
        for (Path p : paths) {
            scored.add(new ScoredPath(p, scorePath(p, observations, sigma, lossOfFunction, includeFinalNode, noRelationTerm)));
        }
        scored.sort(Comparator.comparingInt((ScoredPath s) -> s.path().length()));
        scored.sort(Comparator.comparingDouble(ScoredPath::score).reversed());
        LOG.debugf("Scored %d path(s) against %d observation(s)", scored.size(), observations.size());
        return scored;
    }

    private double scorePath(Path path, ObservationTable observations, double sigma,
                             boolean lossOfFunction, boolean includeFinalNode, double noRelationTerm) {
        List<SignedNode> nodes = path.nodes();
        int end = includeFinalNode ? nodes.size() : nodes.size() - 1;
        double total = 0.0;
        for (int i = 0; i < end; i++) {
            SignedNode node = nodes.get(i);
            List<ObservableRelation> relations = index.relationsOf(node.node());
            if (relations.isEmpty()) {
                total += noRelationTerm;
                continue;
            }
            for (ObservableRelation rel : relations) {
                OptionalDouble measured = observations.valueOf(rel.observableId());
                if (measured.isEmpty()) continue;
                int predicted = node.sign() * rel.sign() * (lossOfFunction ? -1 : 1);
                total += predicted <= 0
                        ? logCdfAtZero(measured.getAsDouble(), sigma)
                        : logSurvivalAtZero(measured.getAsDouble(), sigma);
            }
        }
        return total;
    }

    /** log P(X <= 0) for X ~ N(mean, sigma). */
    static double logCdfAtZero(double mean, double sigma) {
        return logStandardNormalCdf(-mean / sigma);
    }

    /** log P(X > 0) for X ~ N(mean, sigma), computed as P(-X <= 0). */
    static double logSurvivalAtZero(double mean, double sigma) {
        return logStandardNormalCdf(mean / sigma);
    }

    static double logStandardNormalCdf(double z) {
        if (z < ASYMPTOTIC_TAIL) {
            double z2 = z * z;
            return -0.5 * z2 - Math.log(-z) - HALF_LOG_2PI + Math.log1p(-1.0 / z2 + 3.0 / (z2 * z2));
        }
        return Math.log(0.5 * Erf.erfc(-z / SQRT2));
    }

    private static void requireSigma(double sigma) {
        if (!(sigma > 0.0) || Double.isInfinite(sigma)) {
            throw new IllegalArgumentException("sigma must be a positive finite number, got " + sigma);
        }
    }
}
