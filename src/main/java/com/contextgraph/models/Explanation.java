package com.contextgraph.models;

import java.time.Instant;
import java.util.List;

/**
 * "Why did this happen" view of a persisted record: four ordered chains plus a
 * one-line summary. Derived on demand, never stored.
 */
public final class Explanation {

    private final String decisionId;
    private final String runId;
    private final Instant timestamp;
    private final Outcome outcome;
    private final String outcomeReason;
    private final Actor actor;
    private final List<EvidenceStep> evidenceChain;
    private final List<PolicyStep> policyChain;
    private final List<ApprovalStep> approvalChain;
    private final List<ActionStep> actionChain;
    private final String summary;

    public Explanation(DecisionRecord record,
                       List<EvidenceStep> evidenceChain,
                       List<PolicyStep> policyChain,
                       List<ApprovalStep> approvalChain,
                       List<ActionStep> actionChain,
                       String summary) {
        this.decisionId = record.getDecisionId();
        this.runId = record.getRunId();
        this.timestamp = record.getTimestamp();
        this.outcome = record.getOutcome();
        this.outcomeReason = record.getOutcomeReason();
        this.actor = record.getActor();
        this.evidenceChain = List.copyOf(evidenceChain);
        this.policyChain = List.copyOf(policyChain);
        this.approvalChain = List.copyOf(approvalChain);
        this.actionChain = List.copyOf(actionChain);
        this.summary = summary;
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

    public String getOutcomeReason() {
        return outcomeReason;
    }

    public Actor getActor() {
        return actor;
    }

    public List<EvidenceStep> getEvidenceChain() {
        return evidenceChain;
    }

    public List<PolicyStep> getPolicyChain() {
        return policyChain;
    }

    public List<ApprovalStep> getApprovalChain() {
        return approvalChain;
    }

    public List<ActionStep> getActionChain() {
        return actionChain;
    }

    public String getSummary() {
        return summary;
    }
}
