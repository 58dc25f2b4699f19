package com.e2eq.causal.score;

import java.util.*;

/** Measured values keyed by observable id. */
public final class ObservationTable {

    private final Map<String, Double> values;

    private ObservationTable(Map<String, Double> values) {
        this.values = values;
    }

    public static ObservationTable of(Map<String, Double> values) {
        return new ObservationTable(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public static ObservationTable empty() {
        return new ObservationTable(Map.of());
    }

    /**
     * Spreads agent level measurements over the observables of each agent. An observable
     * claimed by more than one agent keeps the first value.
     */
    public static ObservationTable fromAgentValues(Map<String, Double> agentValues,
                                                   Map<String, List<String>> agentObservables) {
        Map<String, Double> m = new LinkedHashMap<>();
        agentValues.forEach((agent, value) -> {
            if (value == null) return;
            for (String obs : agentObservables.getOrDefault(agent, List.of())) {
                m.putIfAbsent(obs, value);
            }
        });
        return new ObservationTable(Collections.unmodifiableMap(m));
    }

    /** Measured value, if any. Zero is a measurement like any other. */
    public OptionalDouble valueOf(String observableId) {
        Double v = values.get(observableId);
        return v == null ? OptionalDouble.empty() : OptionalDouble.of(v);
    }

    public int size() {
        return values.size();
    }
}
