package com.e2eq.causal.io;

import com.e2eq.causal.core.NodeType;
import com.e2eq.causal.exceptions.InvalidGraphException;
import com.e2eq.causal.io.InfluenceMapLoader.YEdge;
import com.e2eq.causal.io.InfluenceMapLoader.YInfluenceMap;
import com.e2eq.causal.io.InfluenceMapLoader.YNode;

import java.util.*;

/**
 * Validator for influence-map files: unique node ids, edges between declared nodes,
 * signed edges and observables that point at variable nodes.
 */
final class InfluenceMapValidator {
    private InfluenceMapValidator() {}

    static void validate(YInfluenceMap map) {
        require(map != null, "Influence map is empty");
        Map<String, NodeType> types = new HashMap<>();
        for (YNode n : Optional.ofNullable(map.nodes()).orElse(List.of())) {
            require(n != null && n.id() != null && !n.id().isBlank(), "Node id must be non-empty");
            require(types.put(n.id(), parseNodeType(n.type(), n.id())) == null, "Duplicate node id '" + n.id() + "'");
        }

        for (YEdge e : Optional.ofNullable(map.edges()).orElse(List.of())) {
            require(e != null && e.from() != null && e.to() != null, "Edge must name both 'from' and 'to'");
            require(types.containsKey(e.from()), "Unknown node '" + e.from() + "' in edge " + e.from() + " -> " + e.to());
            require(types.containsKey(e.to()), "Unknown node '" + e.to() + "' in edge " + e.from() + " -> " + e.to());
            if (e.sign() == null) {
                throw new InvalidGraphException(e.from(), e.to(), null);
            }
        }

        Optional.ofNullable(map.observables()).orElse(Map.of()).forEach((agent, obs) -> {
            for (String o : Optional.ofNullable(obs).orElse(List.of())) {
                require(types.containsKey(o), "Unknown observable '" + o + "' for agent " + agent);
                require(types.get(o) == NodeType.VARIABLE, "Observable '" + o + "' of agent " + agent + " is not a variable node");
            }
        });
    }

    static NodeType parseNodeType(String type, String nodeId) {
        if (type == null || type.isBlank()) return NodeType.RULE;
        try {
            return NodeType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException iae) {
            throw new IllegalArgumentException("Unknown node type '" + type + "' for node '" + nodeId
                    + "'. Expected one of: " + Arrays.toString(NodeType.values()));
        }
    }

    private static void require(boolean cond, String msg) {
        if (!cond) throw new IllegalArgumentException(msg);
    }
}
