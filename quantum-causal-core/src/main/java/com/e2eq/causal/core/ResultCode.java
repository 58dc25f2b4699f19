package com.e2eq.causal.core;

/**
 * Outcome of checking a single statement. These are domain results, never thrown.
 */
public enum ResultCode {
    STATEMENT_TYPE_NOT_HANDLED(false),
    SUBJECT_MONOMERS_NOT_FOUND(false),
    OBSERVABLES_NOT_FOUND(false),
    INPUT_RULES_NOT_FOUND(false),
    NO_PATHS_FOUND(false),
    MAX_PATH_LENGTH_EXCEEDED(true),
    MAX_PATHS_ZERO(true),
    PATHS_FOUND(true);

    private final boolean pathFound;

    ResultCode(boolean pathFound) {
        this.pathFound = pathFound;
    }

    /** Whether a result carrying this code reports the relationship as realizable. */
    public boolean pathFound() {
        return pathFound;
    }
}
