package com.e2eq.causal.prune;

import java.util.*;

/**
 * What is known about each rule node of an influence map: its kind, the agent acting
 * as subject, the agent acted upon and, for binding rules, the complex members.
 * Rules absent from the catalog are simply unknown to the contradiction passes.
 */
public final class RuleCatalog {

    public record RuleInfo(String ruleId, RuleKind kind, String subject, String object, Set<String> members) {
        public RuleInfo {
            Objects.requireNonNull(ruleId, "ruleId");
            kind = kind == null ? RuleKind.OTHER : kind;
            members = members == null ? Set.of() : Set.copyOf(members);
        }
    }

    private static final RuleCatalog EMPTY = new RuleCatalog(Map.of());

    private final Map<String, RuleInfo> rules;

    private RuleCatalog(Map<String, RuleInfo> rules) {
        this.rules = rules;
    }

    public static RuleCatalog empty() {
        return EMPTY;
    }

    public static RuleCatalog of(Collection<RuleInfo> rules) {
        Map<String, RuleInfo> m = new LinkedHashMap<>();
        for (RuleInfo r : rules) {
            if (m.putIfAbsent(r.ruleId(), r) != null) {
                throw new IllegalArgumentException("Duplicate rule '" + r.ruleId() + "' in rule catalog");
            }
        }
        return new RuleCatalog(Collections.unmodifiableMap(m));
    }

    public Optional<RuleInfo> find(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    public Optional<String> subjectOf(String ruleId) {
        return find(ruleId).map(RuleInfo::subject);
    }

    public Optional<String> objectOf(String ruleId) {
        return find(ruleId).map(RuleInfo::object);
    }

    /** Rules whose subject is the given agent, in catalog order. */
    public List<String> rulesWithSubject(String agent) {
        List<String> out = new ArrayList<>();
        for (RuleInfo r : rules.values()) {
            if (agent.equals(r.subject())) out.add(r.ruleId());
        }
        return out;
    }

    public Collection<RuleInfo> rules() {
        return rules.values();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }
}
