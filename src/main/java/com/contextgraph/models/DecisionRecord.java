package com.contextgraph.models;

import com.contextgraph.Identifiers;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Terminal aggregate for one run.
 *
 * <p>{@code timestamp} is the start of the run, not the time of finalization.
 * Lists keep discovery order end to end. Once emitted a record is only re-persisted
 * under the same {@code decisionId}; nothing in this codebase mutates it afterwards.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DecisionRecord {

    private String decisionId = Identifiers.generateId();
    private String runId;
    private String traceId;
    private String spanId;
    private Instant timestamp;
    private Actor actor;
    private List<EntityRef> subjectEntities = new ArrayList<>();
    private List<Evidence> evidence = new ArrayList<>();
    private List<PolicyEval> policies = new ArrayList<>();
    private List<Approval> approvals = new ArrayList<>();
    private List<Action> actions = new ArrayList<>();
    private Outcome outcome;
    private String outcomeReason;
    private List<String> precedentRefs = new ArrayList<>();
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public DecisionRecord() {
    }

    public DecisionRecord(String runId, Outcome outcome, Instant timestamp) {
        this.runId = runId;
        this.outcome = outcome;
        this.timestamp = timestamp;
    }

    public String getDecisionId() {
        return decisionId;
    }

    public void setDecisionId(String decisionId) {
        this.decisionId = decisionId;
    }

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getSpanId() {
        return spanId;
    }

    public void setSpanId(String spanId) {
        this.spanId = spanId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public Actor getActor() {
        return actor;
    }

    public void setActor(Actor actor) {
        this.actor = actor;
    }

    public List<EntityRef> getSubjectEntities() {
        return subjectEntities;
    }

    public void setSubjectEntities(List<EntityRef> subjectEntities) {
        this.subjectEntities = copy(subjectEntities);
    }

    public List<Evidence> getEvidence() {
        return evidence;
    }

    public void setEvidence(List<Evidence> evidence) {
        this.evidence = copy(evidence);
    }

    public List<PolicyEval> getPolicies() {
        return policies;
    }

    public void setPolicies(List<PolicyEval> policies) {
        this.policies = copy(policies);
    }

    public List<Approval> getApprovals() {
        return approvals;
    }

    public void setApprovals(List<Approval> approvals) {
        this.approvals = copy(approvals);
    }

    public List<Action> getActions() {
        return actions;
    }

    public void setActions(List<Action> actions) {
        this.actions = copy(actions);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public void setOutcome(Outcome outcome) {
        this.outcome = outcome;
    }

    public String getOutcomeReason() {
        return outcomeReason;
    }

    public void setOutcomeReason(String outcomeReason) {
        this.outcomeReason = outcomeReason;
    }

    public List<String> getPrecedentRefs() {
        return precedentRefs;
    }

    public void setPrecedentRefs(List<String> precedentRefs) {
        this.precedentRefs = copy(precedentRefs);
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    private static <T> List<T> copy(List<T> source) {
        return source != null ? new ArrayList<>(source) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "DecisionRecord{" +
            "decisionId='" + decisionId + '\'' +
            ", runId='" + runId + '\'' +
            ", outcome=" + outcome +
            ", evidence=" + evidence.size() +
            ", policies=" + policies.size() +
            ", approvals=" + approvals.size() +
            ", actions=" + actions.size() +
            '}';
    }
}
