package com.e2eq.causal.runtime;

import com.e2eq.causal.check.RuleBasedQueryAdapter;
import com.e2eq.causal.check.StatementPathChecker;
import com.e2eq.causal.core.InfluenceGraph;
import com.e2eq.causal.core.SignedGraph;
import com.e2eq.causal.core.SignedGraphBuilder;
import com.e2eq.causal.io.CheckerSettings;
import com.e2eq.causal.io.CheckerSettingsLoader;
import com.e2eq.causal.io.InfluenceMap;
import com.e2eq.causal.io.InfluenceMapLoader;
import com.e2eq.causal.prune.InfluenceGraphPruner;
import com.e2eq.causal.score.ObservableIndex;
import com.e2eq.causal.score.PathScorer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads the checker settings and the influence map from the classpath once, prunes the
 * map, builds the signed graph and exposes the results for injection. Applications only
 * gain these beans when they depend on the module.
 */
@ApplicationScoped
public class CausalCheckerProducer {

    private static final Logger LOG = Logger.getLogger(CausalCheckerProducer.class);

    private final String settingsLocation;
    private final String influenceMapLocation;

    private CheckerSettings settings;
    private InfluenceMap influenceMap;
    private InfluenceGraph prunedGraph;
    private SignedGraph signedGraph;
    private ObservableIndex observableIndex;
    private StatementPathChecker<String> checker;
    private PathScorer scorer;

    @Inject
    public CausalCheckerProducer(@ConfigProperty(name = "quantum.causal.settings", defaultValue = "causal/checker.yaml")
                                 String settingsLocation,
                                 @ConfigProperty(name = "quantum.causal.influence-map", defaultValue = "causal/influence-map.yaml")
                                 String influenceMapLocation) {
        this.settingsLocation = settingsLocation;
        this.influenceMapLocation = influenceMapLocation;
    }

    @PostConstruct
    void init() {
        this.settings = loadSettings();
        this.influenceMap = loadInfluenceMap();

        InfluenceGraphPruner pruner = new InfluenceGraphPruner(settings.pruning(), settings.signConvention());
        this.prunedGraph = pruner.prune(influenceMap.graph(), influenceMap.parameterIds(), influenceMap.catalog());
        this.signedGraph = new SignedGraphBuilder()
                .build(prunedGraph, settings.signConvention(), settings.pruneDanglingNegatives());
        this.observableIndex = ObservableIndex.fromInfluenceMap(prunedGraph, settings.signConvention());
        this.checker = new StatementPathChecker<>(signedGraph,
                new RuleBasedQueryAdapter(signedGraph, influenceMap.catalog(), influenceMap.agentObservables()),
                settings.maxPaths(), settings.maxPathLength());
        this.scorer = new PathScorer(observableIndex, settings.sigma(),
                settings.lossOfFunction(), settings.includeFinalNode());
        LOG.infof("Causal checker ready: %s from %s", signedGraph, influenceMapLocation);
    }

    @Produces
    public CheckerSettings settings() {
        return settings;
    }

    @Produces
    public InfluenceMap influenceMap() {
        return influenceMap;
    }

    /** The influence graph after pruning. */
    @Produces
    public InfluenceGraph influenceGraph() {
        return prunedGraph;
    }

    @Produces
    public SignedGraph signedGraph() {
        return signedGraph;
    }

    @Produces
    public ObservableIndex observableIndex() {
        return observableIndex;
    }

    @Produces
    public StatementPathChecker<String> checker() {
        return checker;
    }

    @Produces
    public PathScorer scorer() {
        return scorer;
    }

    private CheckerSettings loadSettings() {
        try (InputStream stream = open(settingsLocation)) {
            if (stream == null) {
                LOG.infof("No checker settings at %s, using defaults", settingsLocation);
                return CheckerSettings.defaults();
            }
            return new CheckerSettingsLoader().load(stream);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load checker settings from " + settingsLocation, e);
        }
    }

    private InfluenceMap loadInfluenceMap() {
        try (InputStream stream = open(influenceMapLocation)) {
            if (stream == null) {
                throw new IllegalStateException("Unable to locate influence map resource at " + influenceMapLocation);
            }
            return new InfluenceMapLoader().load(stream);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load influence map from " + influenceMapLocation, e);
        }
    }

    private static InputStream open(String location) {
        return Thread.currentThread().getContextClassLoader().getResourceAsStream(location);
    }
}
