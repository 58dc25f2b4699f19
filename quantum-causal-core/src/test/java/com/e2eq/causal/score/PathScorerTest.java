package com.e2eq.causal.score;

import com.e2eq.causal.core.*;
import com.e2eq.causal.score.ObservableIndex.ObservableRelation;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class PathScorerTest {

    private static final double EPS = 1e-9;

    private final ObservableIndex index = ObservableIndex.of(Map.of(
            "up", List.of(new ObservableRelation("obs", 1)),
            "down", List.of(new ObservableRelation("obs", -1))));

    @Test
    void agreeingPredictionScoresHigher() {
        Path viaUp = Path.of(SignedNode.positive("up"), SignedNode.positive("T"));
        Path viaDown = Path.of(SignedNode.positive("down"), SignedNode.positive("T"));
        ObservationTable obs = ObservationTable.of(Map.of("obs", 1.0));

        List<ScoredPath> ranked = new PathScorer(index).score(List.of(viaDown, viaUp), obs);

        assertEquals(viaUp, ranked.get(0).path());
        assertEquals(viaDown, ranked.get(1).path());
        assertTrue(ranked.get(0).score() > ranked.get(1).score());
        assertEquals(PathScorer.logSurvivalAtZero(1.0, 0.15), ranked.get(0).score(), EPS);
        assertEquals(PathScorer.logCdfAtZero(1.0, 0.15), ranked.get(1).score(), EPS);
    }

    @Test
    void negativeNodeFlipsPrediction() {
        Path p = Path.of(SignedNode.negative("up"), SignedNode.positive("T"));
        ObservationTable obs = ObservationTable.of(Map.of("obs", -0.5));
        double s = new PathScorer(index).score(List.of(p), obs).get(0).score();
        assertEquals(PathScorer.logCdfAtZero(-0.5, 0.15), s, EPS);
    }

    @Test
    void lossOfFunctionFlipsPrediction() {
        Path p = Path.of(SignedNode.positive("up"), SignedNode.positive("T"));
        ObservationTable obs = ObservationTable.of(Map.of("obs", 0.3));
        double s = new PathScorer(index).score(List.of(p), obs, true, false).get(0).score();
        assertEquals(PathScorer.logCdfAtZero(0.3, 0.15), s, EPS);
    }

    @Test
    void nodesWithoutObservablesContributeHalf() {
        Path p = Path.of(SignedNode.positive("x"), SignedNode.positive("y"), SignedNode.positive("T"));
        double s = new PathScorer(index).score(List.of(p), ObservationTable.empty()).get(0).score();
        assertEquals(2 * Math.log(0.5), s, EPS);
    }

    @Test
    void unmeasuredObservablesAreSkippedButZeroCounts() {
        Path p = Path.of(SignedNode.positive("up"), SignedNode.positive("T"));
        PathScorer scorer = new PathScorer(index);
        assertEquals(0.0, scorer.score(List.of(p), ObservationTable.empty()).get(0).score(), EPS);
        // a measured zero sits exactly at the decision boundary
        assertEquals(Math.log(0.5), scorer.score(List.of(p), ObservationTable.of(Map.of("obs", 0.0))).get(0).score(), EPS);
    }

    @Test
    void finalNodeIsOptional() {
        Path p = Path.of(SignedNode.positive("x"), SignedNode.positive("up"));
        ObservationTable obs = ObservationTable.of(Map.of("obs", 1.0));
        PathScorer scorer = new PathScorer(index);
        assertEquals(Math.log(0.5), scorer.score(List.of(p), obs).get(0).score(), EPS);
        assertEquals(Math.log(0.5) + PathScorer.logSurvivalAtZero(1.0, 0.15),
                scorer.score(List.of(p), obs, false, true).get(0).score(), EPS);
    }

    @Test
    void tiesKeepShorterPathsFirst() {
        Path longer = Path.of(SignedNode.positive("a"), SignedNode.positive("b"), SignedNode.positive("c"), SignedNode.positive("T"));
        Path shorter = Path.of(SignedNode.positive("a"), SignedNode.positive("T"));
        ObservableIndex none = ObservableIndex.of(Map.of());
        // both score the same when nothing relates to observables and includeFinalNode is off
        ObservationTable obs = ObservationTable.empty();
        PathScorer scorer = new PathScorer(none);

        List<ScoredPath> ranked = scorer.score(List.of(longer, shorter), obs);
        // shorter has one scored node, longer three; log 0.5 < 0 so the shorter one wins
        assertEquals(shorter, ranked.get(0).path());

        Path sameLenA = Path.of(SignedNode.positive("a"), SignedNode.positive("T"));
        Path sameLenB = Path.of(SignedNode.positive("b"), SignedNode.positive("T"));
        List<ScoredPath> stable = scorer.score(List.of(sameLenB, sameLenA), obs);
        assertEquals(sameLenB, stable.get(0).path());
    }

    @Test
    void sortedByScoreThenLength() {
        Random rnd = new Random(5);
        ObservationTable obs = ObservationTable.of(Map.of("obs", 0.4));
        String[] names = {"up", "down", "x"};
        List<Path> paths = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            List<SignedNode> nodes = new ArrayList<>();
            int len = 1 + rnd.nextInt(4);
            for (int j = 0; j <= len; j++) {
                nodes.add(new SignedNode(names[rnd.nextInt(3)], rnd.nextInt(2)));
            }
            paths.add(Path.of(nodes));
        }
        List<ScoredPath> ranked = new PathScorer(index).score(paths, obs);
        for (int i = 1; i < ranked.size(); i++) {
            ScoredPath prev = ranked.get(i - 1);
            ScoredPath cur = ranked.get(i);
            assertTrue(prev.score() >= cur.score());
            if (prev.score() == cur.score()) {
                assertTrue(prev.path().length() <= cur.path().length());
            }
        }
    }

    @Test
    void indexFromInfluenceMapUsesRuleToVariableEdges() {
        InfluenceGraph g = InfluenceGraph.builder()
                .addNode("r1", NodeType.RULE)
                .addNode("r2", NodeType.RULE)
                .addNode("o1", NodeType.VARIABLE)
                .addEdge("r1", "o1", -1)
                .addEdge("r1", "r2", 1)
                .build();
        ObservableIndex idx = ObservableIndex.fromInfluenceMap(g, EdgeSignConvention.MULTIPLIER);
        assertEquals(List.of(new ObservableRelation("o1", -1)), idx.relationsOf("r1"));
        assertTrue(idx.relationsOf("r2").isEmpty());
    }

    @Test
    void agentValuesSpreadOverObservables() {
        ObservationTable t = ObservationTable.fromAgentValues(Map.of("B", 0.7),
                Map.of("B", List.of("B_obs", "B_p_obs")));
        assertEquals(0.7, t.valueOf("B_p_obs").orElseThrow(), EPS);
        assertTrue(t.valueOf("C_obs").isEmpty());
    }

    @Test
    void rejectsNonPositiveSigma() {
        assertThrows(IllegalArgumentException.class, () -> new PathScorer(index, 0.0));
        PathScorer scorer = new PathScorer(index);
        assertThrows(IllegalArgumentException.class,
                () -> scorer.score(List.of(), ObservationTable.empty(), -1.0, false, false));
    }

    @Test
    void extremeMeasurementKeepsTheRestOfTheEvidence() {
        ObservableIndex idx = ObservableIndex.of(Map.of(
                "X", List.of(new ObservableRelation("o1", 1)),
                "Y", List.of(new ObservableRelation("o2", 1)),
                "Z", List.of(new ObservableRelation("o2", -1))));
        // o1 sits more than 40 sigma below zero, o2 agrees with Z and contradicts Y
        ObservationTable obs = ObservationTable.of(Map.of("o1", -7.0, "o2", -1.0));
        Path viaY = Path.of(SignedNode.positive("X"), SignedNode.positive("Y"), SignedNode.positive("T"));
        Path viaZ = Path.of(SignedNode.positive("X"), SignedNode.positive("Z"), SignedNode.positive("T"));

        List<ScoredPath> ranked = new PathScorer(idx).score(List.of(viaY, viaZ), obs);

        assertEquals(viaZ, ranked.get(0).path());
        for (ScoredPath sp : ranked) {
            assertFalse(Double.isInfinite(sp.score()), "infinite score for " + sp.path());
        }
        assertTrue(ranked.get(0).score() > ranked.get(1).score());
    }

    @Test
    void logTailMatchesDistributionAndStaysFinite() {
        NormalDistribution std = new NormalDistribution(null, 0.0, 1.0);
        for (double z : new double[]{-8.0, -5.0, -1.5, 0.0, 0.7, 4.0}) {
            assertEquals(Math.log(std.cumulativeProbability(z)), PathScorer.logStandardNormalCdf(z), 1e-9, "z=" + z);
        }
        assertEquals(-804.6084420137538, PathScorer.logStandardNormalCdf(-40.0), 1e-6);
        assertEquals(PathScorer.logStandardNormalCdf(-29.999), PathScorer.logStandardNormalCdf(-30.001), 0.1);
        assertTrue(PathScorer.logStandardNormalCdf(-30.001) < PathScorer.logStandardNormalCdf(-29.999));
        assertTrue(Double.isFinite(PathScorer.logCdfAtZero(1e3, 0.15)));
        assertEquals(0.0, PathScorer.logSurvivalAtZero(1e3, 0.15), EPS);
    }

    @Test
    void constructorDefaultsApplyToShortScore() {
        Path p = Path.of(SignedNode.positive("x"), SignedNode.positive("up"));
        ObservationTable obs = ObservationTable.of(Map.of("obs", 1.0));
        PathScorer scorer = new PathScorer(index, 0.15, true, true);
        assertTrue(scorer.isLossOfFunction());
        assertTrue(scorer.isIncludeFinalNode());
        assertEquals(Math.log(0.5) + PathScorer.logCdfAtZero(1.0, 0.15),
                scorer.score(List.of(p), obs).get(0).score(), EPS);
    }
}
