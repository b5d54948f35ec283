package com.contextgraph.storage;

import com.contextgraph.models.Outcome;

/**
 * Filters and paging for {@link DecisionStore#list}.
 */
public final class DecisionQuery {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 100;

    private final String runId;
    private final Outcome outcome;
    private final int limit;
    private final int offset;

    private DecisionQuery(String runId, Outcome outcome, int limit, int offset) {
        this.runId = runId;
        this.outcome = outcome;
        this.limit = limit;
        this.offset = offset;
    }

    /**
     * @throws IllegalArgumentException when limit is outside 1..100 or offset is negative
     */
    public static DecisionQuery of(String runId, Outcome outcome, int limit, int offset) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        String run = runId != null && !runId.isBlank() ? runId.trim() : null;
        return new DecisionQuery(run, outcome, limit, offset);
    }

    public static DecisionQuery all() {
        return of(null, null, DEFAULT_LIMIT, 0);
    }

    public String getRunId() {
        return runId;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public int getLimit() {
        return limit;
    }

    public int getOffset() {
        return offset;
    }
}
