package com.contextgraph.capture;

import com.contextgraph.AppLogger;
import com.contextgraph.Identifiers;
import com.contextgraph.models.Action;
import com.contextgraph.models.Actor;
import com.contextgraph.models.Approval;
import com.contextgraph.models.DecisionRecord;
import com.contextgraph.models.EntityRef;
import com.contextgraph.models.Evidence;
import com.contextgraph.models.Outcome;
import com.contextgraph.models.PolicyEval;
import com.contextgraph.models.PolicyResult;
import com.contextgraph.tools.NormalizedEvent;
import com.contextgraph.tools.Payloads;
import com.contextgraph.tools.ToolClassifier;
import com.contextgraph.tools.ToolKind;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable per-run state that turns a stream of tool-call notifications, policy
 * checks and interrupt/resume cycles into exactly one {@link DecisionRecord}.
 *
 * <pre>
 *   ACTIVE --onInterrupt--> INTERRUPTED --onResume--> ACTIVE
 *   ACTIVE | INTERRUPTED --finalizeRecord--> FINALIZED
 * </pre>
 *
 * Single writer: only the control flow driving this run may call into it, and
 * nothing here blocks. An interrupt is a logical state; the host framework does the
 * actual pausing and later calls {@link #onResume}. Errors seen while accumulating
 * become audit data (a failed action, a warn-level policy evaluation) instead of
 * exceptions.
 */
public class RunAccumulator {

    private final String runId;
    private final Actor actor;
    private final ToolClassifier classifier;
    private final Clock clock;
    private final Instant startTime;
    private final AppLogger logger = AppLogger.get();

    private final List<Evidence> evidence = new ArrayList<>();
    private final List<Action> actions = new ArrayList<>();
    private final List<PolicyEval> policies = new ArrayList<>();
    private final List<Approval> approvals = new ArrayList<>();
    private final List<EntityRef> subjectEntities = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private final Set<String> seenIds = new HashSet<>();

    private RunState state = RunState.ACTIVE;
    private boolean pendingInterrupt;
    private boolean success = true;
    private String outcomeReason;
    private String traceId;
    private String spanId;
    private DecisionRecord finalRecord;

    public RunAccumulator(String runId, Actor actor, ToolClassifier classifier) {
        this(runId, actor, classifier, Clock.systemUTC());
    }

    public RunAccumulator(String runId, Actor actor, ToolClassifier classifier, Clock clock) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId is required");
        }
        this.runId = runId;
        this.actor = actor;
        this.classifier = classifier != null ? classifier : new ToolClassifier();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.startTime = this.clock.instant();
    }

    /**
     * Record one tool call. A repeated {@code id} is a re-delivery and is ignored.
     *
     * @return true if the event added an evidence or action entry
     */
    public boolean recordNotification(NormalizedEvent event) {
        if (event == null || rejectWhenFinalized("notification")) {
            return false;
        }
        String id = event.getId() != null && !event.getId().isBlank() ? event.getId() : Identifiers.generateId();
        if (!seenIds.add(id)) {
            logger.debug("[RunAccumulator] Duplicate notification " + id + " ignored for run " + runId);
            return false;
        }

        ToolKind kind = event.getKind() != null ? event.getKind() : classifier.classify(event.getToolName());
        Instant at = event.getTimestamp() != null ? event.getTimestamp() : clock.instant();

        if (kind == ToolKind.WRITE) {
            Action action = new Action(event.getToolName(), at, Payloads.copyArgs(event.getArgs()),
                Payloads.asMap(event.getOutput()), !event.hasError());
            action.setActionId(id);
            actions.add(action);
            if (event.hasError()) {
                success = false;
                outcomeReason = "tool " + event.getToolName() + " failed: " + event.getError();
                logger.warn("[RunAccumulator] " + outcomeReason + " (run " + runId + ")");
            }
        } else {
            Evidence item = new Evidence(event.getToolName(), at);
            item.setEvidenceId(id);
            item.setToolName(event.getToolName());
            item.setToolArgs(Payloads.copyArgs(event.getArgs()));
            item.setSnapshot(Payloads.asMap(event.getOutput()));
            evidence.add(item);
        }
        return true;
    }

    /**
     * Always appended: a re-evaluation is its own event.
     */
    public void recordPolicy(String policyId, String version, PolicyResult result, String message) {
        if (rejectWhenFinalized("policy " + policyId)) {
            return;
        }
        policies.add(new PolicyEval(policyId, version, result, message));
    }

    /**
     * Run an external policy check before a tool executes and record its verdict.
     * A check that throws is recorded as {@code warn} with the error message and the
     * tool is allowed to proceed.
     *
     * @return false only when the check explicitly failed
     */
    public boolean checkPolicy(String policyId, String version, PolicyCheck check,
                               String toolName, Map<String, Object> args) {
        if (check == null || rejectWhenFinalized("policy " + policyId)) {
            return true;
        }
        PolicyVerdict verdict;
        try {
            verdict = check.evaluate(toolName, args != null ? args : Map.of());
        } catch (Exception e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            logger.warn("[RunAccumulator] Policy " + policyId + " error: " + message);
            policies.add(new PolicyEval(policyId, version, PolicyResult.WARN, message));
            return true;
        }
        if (verdict == null || verdict.isPassed()) {
            policies.add(new PolicyEval(policyId, version, PolicyResult.PASS,
                verdict != null ? verdict.getMessage() : null));
            return true;
        }
        policies.add(new PolicyEval(policyId, version, PolicyResult.FAIL, verdict.getMessage()));
        logger.info("[RunAccumulator] Policy " + policyId + " blocked tool " + toolName + ": " + verdict.getMessage());
        return false;
    }

    public void onInterrupt(Object payload) {
        if (rejectWhenFinalized("interrupt")) {
            return;
        }
        pendingInterrupt = true;
        state = RunState.INTERRUPTED;
        Evidence item = new Evidence("interrupt", clock.instant());
        item.setSnapshot(Payloads.asMap(payload));
        evidence.add(item);
        logger.debug("[RunAccumulator] Interrupt recorded for run " + runId);
    }

    /**
     * Records a granted approval, but only when an interrupt is pending.
     *
     * @return true if an approval was recorded
     */
    public boolean onResume(String approverId, Object resumeValue) {
        if (rejectWhenFinalized("resume")) {
            return false;
        }
        if (!pendingInterrupt) {
            logger.debug("[RunAccumulator] Resume without pending interrupt ignored for run " + runId);
            return false;
        }
        approvals.add(new Approval(Actor.human(approverId), true, clock.instant(),
            resumeValue != null ? String.valueOf(resumeValue) : null));
        pendingInterrupt = false;
        state = RunState.ACTIVE;
        logger.debug("[RunAccumulator] Resume approved by " + approverId + " for run " + runId);
        return true;
    }

    public void addSubjectEntity(EntityRef entity) {
        if (entity != null && !subjectEntities.contains(entity) && !rejectWhenFinalized("subject entity")) {
            subjectEntities.add(entity);
        }
    }

    public void putMetadata(String key, Object value) {
        if (key != null && !rejectWhenFinalized("metadata " + key)) {
            metadata.put(key, value);
        }
    }

    public void setTraceContext(String traceId, String spanId) {
        if (!rejectWhenFinalized("trace context")) {
            this.traceId = traceId;
            this.spanId = spanId;
        }
    }

    public DecisionRecord finalizeRecord() {
        return finalizeRecord(TerminalSignal.COMPLETED, null);
    }

    public DecisionRecord finalizeRecord(TerminalSignal signal) {
        return finalizeRecord(signal, null);
    }

    /**
     * Decide the outcome and emit the record. Idempotent: later calls return the
     * first result. Returns null when no action was ever recorded, since a run that
     * only observed has nothing to audit.
     *
     * <p>Outcome precedence, highest first:
     * <ol>
     *   <li>a denying terminal signal (error, tool error, cancel, timeout)</li>
     *   <li>a failed policy; the reason is the first failed policy's message</li>
     *   <li>a failed write; the reason is the recorded tool failure</li>
     *   <li>committed</li>
     * </ol>
     */
    public DecisionRecord finalizeRecord(TerminalSignal signal, String reason) {
        if (state == RunState.FINALIZED) {
            return finalRecord;
        }
        state = RunState.FINALIZED;
        if (actions.isEmpty()) {
            logger.debug("[RunAccumulator] No actions for run " + runId + ", skipping decision record");
            return null;
        }

        TerminalSignal terminal = signal != null ? signal : TerminalSignal.COMPLETED;
        PolicyEval blocking = firstFailedPolicy();
        Outcome outcome;
        String finalReason;
        if (terminal.isDenial()) {
            outcome = Outcome.DENIED;
            if (reason != null) {
                finalReason = reason;
            } else if (outcomeReason != null) {
                finalReason = outcomeReason;
            } else {
                finalReason = "run ended with " + terminal.getValue();
            }
        } else if (blocking != null) {
            outcome = Outcome.DENIED;
            finalReason = blocking.getMessage() != null
                ? blocking.getMessage()
                : "Blocked by policy " + blocking.getPolicyId();
        } else if (!success) {
            outcome = Outcome.DENIED;
            finalReason = outcomeReason;
        } else {
            outcome = Outcome.COMMITTED;
            finalReason = reason;
        }

        DecisionRecord record = new DecisionRecord(runId, outcome, startTime);
        record.setOutcomeReason(finalReason);
        record.setActor(actor);
        record.setTraceId(traceId);
        record.setSpanId(spanId);
        record.setSubjectEntities(subjectEntities);
        record.setEvidence(evidence);
        record.setPolicies(policies);
        record.setApprovals(approvals);
        record.setActions(actions);
        record.setMetadata(metadata);
        finalRecord = record;

        logger.info("[RunAccumulator] Finalized run " + runId + " as " + outcome
            + " (decision " + record.getDecisionId() + ")");
        return record;
    }

    private PolicyEval firstFailedPolicy() {
        for (PolicyEval policy : policies) {
            if (policy.getResult() == PolicyResult.FAIL) {
                return policy;
            }
        }
        return null;
    }

    private boolean rejectWhenFinalized(String what) {
        if (state == RunState.FINALIZED) {
            logger.warn("[RunAccumulator] Run " + runId + " already finalized; ignoring " + what);
            return true;
        }
        return false;
    }

    public String getRunId() {
        return runId;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public RunState getState() {
        return state;
    }

    public boolean isPendingInterrupt() {
        return pendingInterrupt;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getOutcomeReason() {
        return outcomeReason;
    }

    public List<Evidence> getEvidence() {
        return Collections.unmodifiableList(evidence);
    }

    public List<Action> getActions() {
        return Collections.unmodifiableList(actions);
    }

    public List<PolicyEval> getPolicies() {
        return Collections.unmodifiableList(policies);
    }

    public List<Approval> getApprovals() {
        return Collections.unmodifiableList(approvals);
    }
}
