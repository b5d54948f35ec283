package com.contextgraph.client;

import com.contextgraph.models.Action;
import com.contextgraph.models.Actor;
import com.contextgraph.models.ActorType;
import com.contextgraph.models.Approval;
import com.contextgraph.models.DecisionRecord;
import com.contextgraph.models.EntityRef;
import com.contextgraph.models.Evidence;
import com.contextgraph.models.Outcome;
import com.contextgraph.models.PolicyEval;
import com.contextgraph.models.PolicyResult;
import com.contextgraph.tools.Payloads;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a decision record by hand, for callers without a framework adapter.
 *
 * <pre>
 * client.startDecision("run-7", "refund-agent")
 *     .addEvidence("get_order", Map.of("id", "o-1"), order)
 *     .addPolicy("refund-limit", "1.0", PolicyResult.PASS, null)
 *     .addAction("issue_refund", Map.of("amount", 20), receipt, true)
 *     .commit(Outcome.COMMITTED, null);
 * </pre>
 */
public class DecisionRecordBuilder {

    private final ContextGraphClient client;
    private final String runId;
    private final Actor actor;
    private final Clock clock;
    private final Instant startTime;

    private final List<Evidence> evidence = new ArrayList<>();
    private final List<Action> actions = new ArrayList<>();
    private final List<PolicyEval> policies = new ArrayList<>();
    private final List<Approval> approvals = new ArrayList<>();
    private final List<EntityRef> subjectEntities = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private String traceId;
    private String spanId;

    DecisionRecordBuilder(ContextGraphClient client, String runId, String actorId, ActorType actorType, Clock clock) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId is required");
        }
        this.client = client;
        this.runId = runId;
        this.actor = actorId != null && !actorId.isBlank() ? new Actor(actorType, actorId) : null;
        this.clock = clock;
        this.startTime = clock.instant();
    }

    public DecisionRecordBuilder addEvidence(String toolName, Map<String, Object> toolArgs, Object result) {
        return addEvidence(toolName, toolArgs, result, null);
    }

    /**
     * @param source defaults to {@code toolName}
     */
    public DecisionRecordBuilder addEvidence(String toolName, Map<String, Object> toolArgs, Object result,
                                             String source) {
        Evidence item = new Evidence(source != null ? source : toolName, clock.instant());
        item.setToolName(toolName);
        item.setToolArgs(Payloads.copyArgs(toolArgs));
        item.setSnapshot(wrap(result));
        evidence.add(item);
        return this;
    }

    public DecisionRecordBuilder addAction(String toolName, Map<String, Object> toolArgs, Object result,
                                           boolean success) {
        actions.add(new Action(toolName, clock.instant(), Payloads.copyArgs(toolArgs), wrap(result), success));
        return this;
    }

    public DecisionRecordBuilder addPolicy(String policyId, String version, PolicyResult result, String message) {
        policies.add(new PolicyEval(policyId, version, result, message));
        return this;
    }

    public DecisionRecordBuilder addApproval(String approverId, boolean granted, String reason) {
        approvals.add(new Approval(Actor.human(approverId), granted, clock.instant(), reason));
        return this;
    }

    public DecisionRecordBuilder subjectEntity(EntityRef entity) {
        if (entity != null) {
            subjectEntities.add(entity);
        }
        return this;
    }

    public DecisionRecordBuilder metadata(String key, Object value) {
        metadata.put(key, value);
        return this;
    }

    public DecisionRecordBuilder traceContext(String traceId, String spanId) {
        this.traceId = traceId;
        this.spanId = spanId;
        return this;
    }

    public DecisionRecord build(Outcome outcome, String reason) {
        DecisionRecord record = new DecisionRecord(runId, outcome != null ? outcome : Outcome.COMMITTED, startTime);
        record.setActor(actor);
        record.setOutcomeReason(reason);
        record.setTraceId(traceId);
        record.setSpanId(spanId);
        record.setSubjectEntities(subjectEntities);
        record.setEvidence(evidence);
        record.setActions(actions);
        record.setPolicies(policies);
        record.setApprovals(approvals);
        record.setMetadata(metadata);
        return record;
    }

    /**
     * Build the record and hand it to the client. Delivery failures follow the
     * client's configuration; the record is returned either way.
     */
    public DecisionRecord commit(Outcome outcome, String reason) {
        DecisionRecord record = build(outcome, reason);
        client.ingest(record);
        return record;
    }

    public DecisionRecord commit() {
        return commit(Outcome.COMMITTED, null);
    }

    private static Map<String, Object> wrap(Object result) {
        Map<String, Object> payload = Payloads.asMap(result);
        if (payload == null) {
            payload = new LinkedHashMap<>();
            payload.put("value", null);
        }
        return payload;
    }
}
