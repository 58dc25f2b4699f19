package com.e2eq.causal.check;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Statement kinds the reference adapters know how to turn into path queries. */
public enum CausalQueryKind {
    MODIFICATION,
    REGULATE_ACTIVITY,
    REGULATE_AMOUNT,
    INFLUENCE;

    // concrete statement types folded into their family
    private static final Map<String, CausalQueryKind> ALIASES = Map.ofEntries(
            Map.entry("ADD_MODIFICATION", MODIFICATION),
            Map.entry("REMOVE_MODIFICATION", MODIFICATION),
            Map.entry("PHOSPHORYLATION", MODIFICATION),
            Map.entry("DEPHOSPHORYLATION", MODIFICATION),
            Map.entry("ACTIVATION", REGULATE_ACTIVITY),
            Map.entry("INHIBITION", REGULATE_ACTIVITY),
            Map.entry("INCREASE_AMOUNT", REGULATE_AMOUNT),
            Map.entry("DECREASE_AMOUNT", REGULATE_AMOUNT)
    );

    /**
     * Accepts {@code REGULATE_AMOUNT}, {@code regulate-amount} and {@code RegulateAmount} alike,
     * as well as concrete types such as {@code DecreaseAmount}. Unknown or blank kinds give an
     * empty result.
     */
    public static Optional<CausalQueryKind> parse(String kind) {
        if (kind == null || kind.isBlank()) return Optional.empty();
        String norm = kind.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toUpperCase(Locale.ROOT);
        for (CausalQueryKind k : values()) {
            if (k.name().equals(norm)) return Optional.of(k);
        }
        return Optional.ofNullable(ALIASES.get(norm));
    }
}
