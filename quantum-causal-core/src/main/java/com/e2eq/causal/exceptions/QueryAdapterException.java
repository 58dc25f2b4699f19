package com.e2eq.causal.exceptions;

import com.e2eq.causal.check.CausalQuery;

/**
 * Thrown when a query adapter breaks its contract, for example by returning no
 * resolution at all or a resolution that names neither an error code nor candidates.
 */
public class QueryAdapterException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final transient CausalQuery query;

    public QueryAdapterException(String message) {
        super(message);
        this.query = null;
    }

    public QueryAdapterException(CausalQuery query, String problem) {
        super(String.format("Query adapter failed for %s: %s", query, problem));
        this.query = query;
    }

    public CausalQuery getQuery() {
        return query;
    }
}
