package com.e2eq.causal.io;

import com.e2eq.causal.core.EdgeSignConvention;
import com.e2eq.causal.prune.PruningOptions;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Loads {@link CheckerSettings} from YAML. Missing keys fall back to
 * {@link CheckerSettings#defaults()}.
 */
public final class CheckerSettingsLoader {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record YSettings(Integer maxPaths, Integer maxPathLength, YScoring scoring,
                            YSignedGraph signedGraph, YPruning pruning) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record YScoring(Double sigma, Boolean lossOfFunction, Boolean includeFinalNode) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record YSignedGraph(Boolean pruneDanglingNegatives, String signConvention) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record YPruning(Boolean selfLoops, Boolean parameterNodes, Boolean mutualRedundancy,
                           Boolean degradeBind, Boolean subjectObject) {}

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public CheckerSettings loadFromClasspath(String resourcePath) throws IOException {
        try (InputStream in = getClass().getResourceAsStream(resourcePath)) {
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            return load(in);
        }
    }

    public CheckerSettings loadFromPath(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public CheckerSettings load(InputStream in) throws IOException {
        YSettings y = mapper.readValue(in, YSettings.class);
        return toSettings(y == null ? new YSettings(null, null, null, null, null) : y);
    }

    private CheckerSettings toSettings(YSettings y) {
        CheckerSettings d = CheckerSettings.defaults();
        PruningOptions dp = d.pruning();
        YScoring s = Optional.ofNullable(y.scoring()).orElse(new YScoring(null, null, null));
        YSignedGraph g = Optional.ofNullable(y.signedGraph()).orElse(new YSignedGraph(null, null));
        YPruning p = Optional.ofNullable(y.pruning()).orElse(new YPruning(null, null, null, null, null));

        PruningOptions pruning = new PruningOptions(
                or(p.selfLoops(), dp.selfLoops()),
                or(p.parameterNodes(), dp.parameterNodes()),
                or(p.mutualRedundancy(), dp.mutualRedundancy()),
                or(p.degradeBind(), dp.degradeBind()),
                or(p.subjectObject(), dp.subjectObject()));

        return new CheckerSettings(
                Optional.ofNullable(y.maxPaths()).orElse(d.maxPaths()),
                Optional.ofNullable(y.maxPathLength()).orElse(d.maxPathLength()),
                Optional.ofNullable(s.sigma()).orElse(d.sigma()),
                or(s.lossOfFunction(), d.lossOfFunction()),
                or(s.includeFinalNode(), d.includeFinalNode()),
                or(g.pruneDanglingNegatives(), d.pruneDanglingNegatives()),
                parseConvention(g.signConvention(), d.signConvention()),
                pruning);
    }

    private static boolean or(Boolean value, boolean fallback) {
        return value != null ? value : fallback;
    }

    private static EdgeSignConvention parseConvention(String value, EdgeSignConvention fallback) {
        if (value == null || value.isBlank()) return fallback;
        try {
            return EdgeSignConvention.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException iae) {
            throw new IllegalArgumentException("Unknown sign convention '" + value + "'. Expected one of: "
                    + Arrays.toString(EdgeSignConvention.values()));
        }
    }
}
