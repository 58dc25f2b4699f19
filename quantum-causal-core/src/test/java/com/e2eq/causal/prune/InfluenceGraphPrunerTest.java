package com.e2eq.causal.prune;

import com.e2eq.causal.core.EdgeSignConvention;
import com.e2eq.causal.core.InfluenceEdge;
import com.e2eq.causal.core.InfluenceGraph;
import com.e2eq.causal.core.NodeType;
import com.e2eq.causal.prune.RuleCatalog.RuleInfo;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class InfluenceGraphPrunerTest {

    private final InfluenceGraphPruner pruner = new InfluenceGraphPruner();

    @Test
    void removesSelfLoopsAndParameters() {
        InfluenceGraph g = InfluenceGraph.builder()
                .addNode("k_typed", NodeType.PARAMETER)
                .addEdge("r1", "r1", 1)
                .addEdge("r1", "r2", 1)
                .addEdge("k1", "r1", 1)
                .addEdge("k_typed", "r2", 1)
                .build();

        InfluenceGraph pruned = pruner.prune(g, Set.of("k1", "not_there"), RuleCatalog.empty());

        assertEquals(Set.of("r1", "r2"), pruned.nodes());
        assertEquals(Set.of(new InfluenceEdge("r1", "r2", 1)), pruned.edges());
        // the input is untouched
        assertEquals(4, g.edgeCount());
    }

    @Test
    void removesMirrorPairs() {
        // p1 and p2 share successor x and point at each other
        InfluenceGraph g = InfluenceGraph.builder()
                .addEdge("p1", "p2", 1)
                .addEdge("p2", "p1", 1)
                .addEdge("p1", "x", 1)
                .addEdge("p2", "x", -1)
                .build();

        InfluenceGraph pruned = pruner.prune(g, Set.of(), RuleCatalog.empty());

        assertTrue(pruned.edgesBetween("p1", "p2").isEmpty());
        assertTrue(pruned.edgesBetween("p2", "p1").isEmpty());
        assertEquals(2, pruned.edgeCount());
    }

    @Test
    void degradeBindRemovesOnlyPositiveEdges() {
        RuleCatalog catalog = RuleCatalog.of(List.of(
                new RuleInfo("deg_B", RuleKind.DECREASE_AMOUNT, "C", "B", Set.of()),
                new RuleInfo("bind_BD", RuleKind.BINDING, "B", "D", Set.of("B", "D")),
                new RuleInfo("bind_CD", RuleKind.BINDING, "C", "D", Set.of("C", "D"))));
        InfluenceGraph g = InfluenceGraph.builder()
                .addEdge("deg_B", "bind_BD", 1)
                .addEdge("deg_B", "bind_BD", -1)
                .addEdge("deg_B", "bind_CD", 1)
                .build();

        InfluenceGraph pruned = pruner.prune(g, Set.of(), catalog);

        assertEquals(Set.of(new InfluenceEdge("deg_B", "bind_BD", -1), new InfluenceEdge("deg_B", "bind_CD", 1)),
                pruned.edges());
    }

    @Test
    void subjectObjectPruningIsOptIn() {
        RuleCatalog catalog = RuleCatalog.of(List.of(
                new RuleInfo("r1", RuleKind.MODIFICATION, "A", "B", Set.of()),
                new RuleInfo("r2", RuleKind.MODIFICATION, "C", "D", Set.of()),
                new RuleInfo("r3", RuleKind.MODIFICATION, "B", "E", Set.of()),
                new RuleInfo("r4", RuleKind.MODIFICATION, null, "F", Set.of())));
        InfluenceGraph g = InfluenceGraph.builder()
                .addEdge("r1", "r2", 1)
                .addEdge("r1", "r3", 1)
                .addEdge("r1", "r4", 1)
                .build();

        assertEquals(3, pruner.prune(g, Set.of(), catalog).edgeCount());

        InfluenceGraphPruner strict = new InfluenceGraphPruner(
                new PruningOptions(true, true, true, true, true), EdgeSignConvention.MULTIPLIER);
        InfluenceGraph pruned = strict.prune(g, Set.of(), catalog);
        // r1 acts on B: r2 (subject C) is incoherent, r3 (subject B) is fine, r4 has no known subject
        assertEquals(Set.of(new InfluenceEdge("r1", "r3", 1), new InfluenceEdge("r1", "r4", 1)), pruned.edges());
    }

    @Test
    void disabledPassesLeaveGraphAlone() {
        InfluenceGraph g = InfluenceGraph.builder()
                .addEdge("r1", "r1", 1)
                .addEdge("k", "r1", 1)
                .build();
        InfluenceGraphPruner noop = new InfluenceGraphPruner(PruningOptions.none(), EdgeSignConvention.MULTIPLIER);
        InfluenceGraph pruned = noop.prune(g, Set.of("k"), RuleCatalog.empty());
        assertEquals(g.edges(), pruned.edges());
    }

    @Test
    void removalThatExposesNewMirrorPairIsCaughtInNextRound() {
        // p1/p3 only become mirrors once the p1 <-> p2 pair is gone
        InfluenceGraph g = InfluenceGraph.builder()
                .addEdge("p1", "p2", 1)
                .addEdge("p2", "p1", 1)
                .addEdge("p1", "p3", 1)
                .addEdge("p3", "p1", 1)
                .addEdge("p2", "p3", 1)
                .addEdge("p1", "x", 1)
                .addEdge("p2", "x", 1)
                .addEdge("p3", "x", 1)
                .build();

        InfluenceGraph once = pruner.prune(g, Set.of(), RuleCatalog.empty());

        assertEquals(Set.of(
                new InfluenceEdge("p2", "p3", 1),
                new InfluenceEdge("p1", "x", 1),
                new InfluenceEdge("p2", "x", 1),
                new InfluenceEdge("p3", "x", 1)), once.edges());
        assertEquals(once.edges(), pruner.prune(once, Set.of(), RuleCatalog.empty()).edges());
    }

    @Test
    void pruningIsIdempotent() {
        Random rnd = new Random(11);
        for (int round = 0; round < 40; round++) {
            InfluenceGraph.Builder b = InfluenceGraph.builder();
            List<RuleInfo> rules = new ArrayList<>();
            String[] agents = {"A", "B", "C"};
            RuleKind[] kinds = {RuleKind.DECREASE_AMOUNT, RuleKind.BINDING, RuleKind.MODIFICATION};
            for (int i = 0; i < 8; i++) {
                String id = "r" + i;
                b.addNode(id);
                rules.add(new RuleInfo(id, kinds[rnd.nextInt(kinds.length)],
                        agents[rnd.nextInt(3)], agents[rnd.nextInt(3)],
                        Set.copyOf(List.of(agents[rnd.nextInt(3)], agents[rnd.nextInt(3)]))));
            }
            b.addNode("k", NodeType.PARAMETER);
            for (int i = 0; i < 20; i++) {
                String u = rnd.nextInt(10) == 0 ? "k" : "r" + rnd.nextInt(8);
                b.addEdge(u, "r" + rnd.nextInt(8), rnd.nextBoolean() ? 1 : -1);
            }
            InfluenceGraph g = b.build();
            RuleCatalog catalog = RuleCatalog.of(rules);
            InfluenceGraphPruner strict = new InfluenceGraphPruner(
                    new PruningOptions(true, true, true, true, rnd.nextBoolean()), EdgeSignConvention.MULTIPLIER);

            InfluenceGraph once = strict.prune(g, Set.of(), catalog);
            InfluenceGraph twice = strict.prune(once, Set.of(), catalog);
            assertEquals(once.nodes(), twice.nodes());
            assertEquals(once.edges(), twice.edges());
        }
    }
}
