package com.contextgraph.models;

import java.time.Instant;

/**
 * Listing row for {@code GET /v1/decisions}.
 */
public final class DecisionSummary {

    private final String decisionId;
    private final String runId;
    private final Instant timestamp;
    private final Outcome outcome;
    private final String actorId;

    public DecisionSummary(String decisionId, String runId, Instant timestamp, Outcome outcome, String actorId) {
        this.decisionId = decisionId;
        this.runId = runId;
        this.timestamp = timestamp;
        this.outcome = outcome;
        this.actorId = actorId;
    }

    public static DecisionSummary of(DecisionRecord record) {
        return new DecisionSummary(
            record.getDecisionId(),
            record.getRunId(),
            record.getTimestamp(),
            record.getOutcome(),
            record.getActor() != null ? record.getActor().getId() : null
        );
    }

    public String getDecisionId() {
        return decisionId;
    }

    public String getRunId() {
        return runId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public String getActorId() {
        return actorId;
    }
}
