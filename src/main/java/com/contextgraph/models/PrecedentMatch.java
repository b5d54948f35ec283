package com.contextgraph.models;

import java.time.Instant;
import java.util.List;

public final class PrecedentMatch {

    private final String decisionId;
    private final String runId;
    private final Instant timestamp;
    private final Outcome outcome;
    private final List<String> matchingPolicies;
    private final List<String> matchingTools;

    public PrecedentMatch(String decisionId, String runId, Instant timestamp, Outcome outcome,
                          List<String> matchingPolicies, List<String> matchingTools) {
        this.decisionId = decisionId;
        this.runId = runId;
        this.timestamp = timestamp;
        this.outcome = outcome;
        this.matchingPolicies = List.copyOf(matchingPolicies);
        this.matchingTools = List.copyOf(matchingTools);
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

    public List<String> getMatchingPolicies() {
        return matchingPolicies;
    }

    public List<String> getMatchingTools() {
        return matchingTools;
    }
}
