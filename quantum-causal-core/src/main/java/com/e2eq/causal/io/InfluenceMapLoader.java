package com.e2eq.causal.io;

import com.e2eq.causal.core.InfluenceGraph;
import com.e2eq.causal.core.NodeType;
import com.e2eq.causal.prune.RuleCatalog;
import com.e2eq.causal.prune.RuleCatalog.RuleInfo;
import com.e2eq.causal.prune.RuleKind;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads an {@link InfluenceMap} from YAML (or JSON, which is valid YAML).
 * <pre>
 * nodes:
 *   - id: degrade_B
 *     type: rule            # rule | variable | parameter
 *     kind: decrease_amount # optional, drives contradiction pruning
 *     subject: A
 *     object: B
 *     members: [A, B]
 * edges:
 *   - {from: degrade_B, to: bind_B_C, sign: -1}
 * parameters: [kf_ab]
 * observables:
 *   B: [B_obs]
 * </pre>
 */
public final class InfluenceMapLoader {

    private static final Logger LOG = Logger.getLogger(InfluenceMapLoader.class);

    // DTOs mirroring YAML
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record YInfluenceMap(List<YNode> nodes, List<YEdge> edges, List<String> parameters,
                                Map<String, List<String>> observables) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record YNode(String id, String type, String kind, String subject, String object, List<String> members) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record YEdge(String from, String to, Integer sign) {}

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public InfluenceMap loadFromClasspath(String resourcePath) throws IOException {
        try (InputStream in = getClass().getResourceAsStream(resourcePath)) {
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            return toInfluenceMap(mapper.readValue(in, YInfluenceMap.class));
        }
    }

    public InfluenceMap loadFromPath(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return toInfluenceMap(mapper.readValue(in, YInfluenceMap.class));
        }
    }

    public InfluenceMap load(InputStream in) throws IOException {
        return toInfluenceMap(mapper.readValue(in, YInfluenceMap.class));
    }

    private InfluenceMap toInfluenceMap(YInfluenceMap y) {
        InfluenceMapValidator.validate(y);
        List<YNode> yNodes = Optional.ofNullable(y.nodes()).orElse(List.of());
        List<YEdge> yEdges = Optional.ofNullable(y.edges()).orElse(List.of());

        InfluenceGraph.Builder builder = InfluenceGraph.builder();
        List<RuleInfo> rules = new ArrayList<>();
        for (YNode n : yNodes) {
            NodeType type = InfluenceMapValidator.parseNodeType(n.type(), n.id());
            builder.addNode(n.id(), type);
            if (n.kind() != null || n.subject() != null || n.object() != null || n.members() != null) {
                rules.add(new RuleInfo(n.id(), RuleKind.parse(n.kind()), n.subject(), n.object(),
                        new LinkedHashSet<>(Optional.ofNullable(n.members()).orElse(List.of()))));
            }
        }
        for (YEdge e : yEdges) {
            builder.addEdge(e.from(), e.to(), e.sign());
        }

        Map<String, List<String>> observables = new LinkedHashMap<>();
        Optional.ofNullable(y.observables()).orElse(Map.of())
                .forEach((agent, obs) -> observables.put(agent, List.copyOf(Optional.ofNullable(obs).orElse(List.of()))));

        InfluenceGraph graph = builder.build();
        LOG.infof("Loaded influence map: %d nodes, %d edges, %d catalogued rules",
                graph.nodeCount(), graph.edgeCount(), rules.size());
        return new InfluenceMap(graph, RuleCatalog.of(rules),
                Set.copyOf(Optional.ofNullable(y.parameters()).orElse(List.of())),
                Collections.unmodifiableMap(observables));
    }
}
