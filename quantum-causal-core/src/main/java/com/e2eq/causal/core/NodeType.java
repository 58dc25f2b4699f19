package com.e2eq.causal.core;

/** Kind of node in an influence map. */
public enum NodeType {
    RULE,
    /** An observable of the model. */
    VARIABLE,
    PARAMETER
}
