package com.e2eq.causal.check;

import org.jboss.logging.Logger;

/**
 * Tracks where a single statement check is in its lifecycle. Once terminal, a check
 * cannot move again.
 */
final class StatementCheck {

    private static final Logger LOG = Logger.getLogger(StatementCheck.class);

    private final CausalQuery query;
    private CheckPhase phase = CheckPhase.UNRESOLVED;

    StatementCheck(CausalQuery query) {
        this.query = query;
    }

    void moveTo(CheckPhase next) {
        if (phase == CheckPhase.TERMINAL) {
            throw new IllegalStateException("Check of " + query + " already terminated");
        }
        LOG.debugf("%s: %s -> %s", query, phase, next);
        phase = next;
    }
}
