package com.e2eq.causal.score;

import com.e2eq.causal.core.EdgeSign;
import com.e2eq.causal.core.EdgeSignConvention;
import com.e2eq.causal.core.InfluenceEdge;
import com.e2eq.causal.core.InfluenceGraph;
import com.e2eq.causal.core.NodeType;

import java.util.*;

/**
 * Which observables each graph node affects, and with which sign.
 */
public final class ObservableIndex {

    public record ObservableRelation(String observableId, int sign) {
        public ObservableRelation {
            Objects.requireNonNull(observableId, "observableId");
            if (sign != 1 && sign != -1) {
                throw new IllegalArgumentException("Relation sign must be +1 or -1, got " + sign);
            }
        }
    }

    private final Map<String, List<ObservableRelation>> relations;

    private ObservableIndex(Map<String, List<ObservableRelation>> relations) {
        this.relations = relations;
    }

    public static ObservableIndex of(Map<String, List<ObservableRelation>> relations) {
        Map<String, List<ObservableRelation>> copy = new LinkedHashMap<>();
        relations.forEach((node, rels) -> copy.put(node, List.copyOf(rels)));
        return new ObservableIndex(Collections.unmodifiableMap(copy));
    }

    /**
     * Reads rule to observable edges off an influence map: every {@link NodeType#RULE}
     * node relates to the {@link NodeType#VARIABLE} nodes it points at, with the edge sign.
     */
    public static ObservableIndex fromInfluenceMap(InfluenceGraph graph, EdgeSignConvention convention) {
        Map<String, List<ObservableRelation>> m = new LinkedHashMap<>();
        for (String node : graph.nodes()) {
            if (graph.typeOf(node) != NodeType.RULE) continue;
            for (InfluenceEdge e : graph.outgoingEdges(node)) {
                if (graph.typeOf(e.target()) != NodeType.VARIABLE) continue;
                EdgeSign sign = convention.decode(e);
                m.computeIfAbsent(node, k -> new ArrayList<>())
                        .add(new ObservableRelation(e.target(), sign.multiplier()));
            }
        }
        return of(m);
    }

    public List<ObservableRelation> relationsOf(String node) {
        return relations.getOrDefault(node, List.of());
    }

    public Set<String> nodes() {
        return relations.keySet();
    }
}
