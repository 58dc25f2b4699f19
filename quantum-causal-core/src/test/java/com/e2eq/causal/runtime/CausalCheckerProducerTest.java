package com.e2eq.causal.runtime;

import com.e2eq.causal.check.CausalQuery;
import com.e2eq.causal.check.CheckedQuery;
import com.e2eq.causal.core.PathResult;
import com.e2eq.causal.core.ResultCode;
import com.e2eq.causal.core.SignedNode;
import com.e2eq.causal.score.ObservationTable;
import com.e2eq.causal.score.ScoredPath;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CausalCheckerProducerTest {

    private CausalCheckerProducer producer() {
        CausalCheckerProducer p = new CausalCheckerProducer("causal/test-checker.yaml", "causal/test-influence-map.yaml");
        p.init();
        return p;
    }

    @Test
    void wiresSettingsGraphAndChecker() {
        CausalCheckerProducer p = producer();

        assertEquals(3, p.settings().maxPaths());
        assertFalse(p.influenceGraph().containsNode("kf"));
        assertTrue(p.influenceGraph().edgesBetween("B_bind_C", "B_bind_C").isEmpty());
        assertTrue(p.influenceGraph().edgesBetween("C_degrades_B", "B_bind_C").isEmpty());
        assertEquals(9, p.influenceMap().graph().edgeCount());
        assertTrue(p.signedGraph().contains(SignedNode.positive("C_obs")));
        assertEquals(0.2, p.scorer().getSigma(), 1e-12);
        assertEquals(2, p.observableIndex().relationsOf("C_degrades_B").size() + p.observableIndex().relationsOf("B_bind_C").size());
    }

    @Test
    void checksAndScoresStatements() {
        CausalCheckerProducer p = producer();
        List<CausalQuery> queries = List.of(
                CausalQuery.increase("A", "C", "Activation"),
                CausalQuery.decrease("A", "C", "Inhibition"),
                CausalQuery.increase("A", "C", "Translocation"));

        List<CheckedQuery> results = p.checker().checkModel(queries, p.settings().maxPaths(), p.settings().maxPathLength());

        assertEquals(ResultCode.PATHS_FOUND, results.get(0).result().getResultCode());
        assertEquals(ResultCode.PATHS_FOUND, results.get(1).result().getResultCode());
        assertEquals(ResultCode.STATEMENT_TYPE_NOT_HANDLED, results.get(2).result().getResultCode());

        PathResult up = results.get(0).result();
        List<ScoredPath> ranked = p.scorer().score(up.getPaths(), ObservationTable.fromAgentValues(
                Map.of("B", 0.5, "C", 0.8), Map.of("B", List.of("B_obs"), "C", List.of("C_obs"))));
        assertEquals(up.getPaths().size(), ranked.size());
        assertTrue(Double.isFinite(ranked.get(0).score()));
    }

    @Test
    void settingsBecomeCheckerAndScorerDefaults() {
        CausalQuery inhibition = CausalQuery.decrease("A", "C", "Inhibition");

        CausalCheckerProducer loose = producer();
        loose.checker().addStatements(List.of(inhibition));
        assertEquals(List.of(inhibition), loose.checker().getStatements());
        PathResult found = loose.checker().checkModel().get(0).result();
        assertEquals(ResultCode.PATHS_FOUND, found.getResultCode());
        assertEquals(3, found.getMaxPaths());
        assertEquals(6, found.getMaxPathLength());

        // the inhibiting route is five hops long, one more than this configuration allows
        CausalCheckerProducer tight = new CausalCheckerProducer("causal/tight-checker.yaml", "causal/test-influence-map.yaml");
        tight.init();
        assertEquals(2, tight.checker().getDefaultMaxPaths());
        assertEquals(4, tight.checker().getDefaultMaxPathLength());
        tight.checker().addStatements(List.of(inhibition));
        assertEquals(ResultCode.MAX_PATH_LENGTH_EXCEEDED, tight.checker().checkModel().get(0).result().getResultCode());
        assertEquals(ResultCode.MAX_PATH_LENGTH_EXCEEDED, tight.checker().checkStatement(inhibition).getResultCode());
        assertTrue(tight.scorer().isLossOfFunction());
        assertTrue(tight.scorer().isIncludeFinalNode());
        assertFalse(loose.scorer().isLossOfFunction());
    }

    @Test
    void missingInfluenceMapFailsFast() {
        CausalCheckerProducer p = new CausalCheckerProducer("causal/test-checker.yaml", "causal/absent.yaml");
        IllegalStateException ex = assertThrows(IllegalStateException.class, p::init);
        assertTrue(ex.getMessage().contains("causal/absent.yaml"));
    }

    @Test
    void missingSettingsFallBackToDefaults() {
        CausalCheckerProducer p = new CausalCheckerProducer("causal/absent-settings.yaml", "causal/test-influence-map.yaml");
        p.init();
        assertEquals(1, p.settings().maxPaths());
    }
}
