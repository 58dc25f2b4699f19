package com.e2eq.causal.check;

/** Lifecycle of a single statement check. */
public enum CheckPhase {
    UNRESOLVED,
    SOURCES_RESOLVED,
    SEARCH_DONE,
    TERMINAL
}
