package com.contextgraph.capture;

import com.contextgraph.ExplainService;
import com.contextgraph.Identifiers;
import com.contextgraph.models.Actor;
import com.contextgraph.models.ActorType;
import com.contextgraph.models.DecisionRecord;
import com.contextgraph.models.Evidence;
import com.contextgraph.models.Outcome;
import com.contextgraph.models.PolicyResult;
import com.contextgraph.models.PolicyStep;
import com.contextgraph.tools.NormalizedEvent;
import com.contextgraph.tools.ToolClassifier;
import com.contextgraph.tools.ToolKind;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RunAccumulatorTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    private RunAccumulator newRun() {
        return new RunAccumulator("run-1", Actor.agent("support-bot"), new ToolClassifier(),
            Clock.fixed(START, ZoneOffset.UTC));
    }

    private static NormalizedEvent read(String id, String tool, Object output) {
        return NormalizedEvent.builder(tool).id(id).output(output).build();
    }

    private static NormalizedEvent write(String id, String tool, String error) {
        return NormalizedEvent.builder(tool).id(id).args(Map.of("amount", 20)).output("done").error(error).build();
    }

    @Test
    void readsBecomeEvidenceAndWritesBecomeActions() {
        RunAccumulator run = newRun();
        run.recordNotification(read("c1", "get_order", Map.of("id", "o-1", "total", 42)));
        run.recordNotification(write("c2", "create_refund", null));

        DecisionRecord record = run.finalizeRecord();

        assertNotNull(record);
        assertEquals(Outcome.COMMITTED, record.getOutcome());
        assertNull(record.getOutcomeReason());
        assertEquals("run-1", record.getRunId());
        assertEquals(START, record.getTimestamp());
        assertEquals(ActorType.AGENT, record.getActor().getType());

        Evidence evidence = record.getEvidence().get(0);
        assertEquals("get_order", evidence.getSource());
        assertEquals(Map.of("id", "o-1", "total", 42), evidence.getSnapshot());
        assertNotNull(evidence.getSnapshotHash());

        assertEquals("create_refund", record.getActions().get(0).getTool());
        assertEquals(Map.of("value", "done"), record.getActions().get(0).getResult());
        assertTrue(record.getActions().get(0).isSuccess());
    }

    @Test
    void preAssignedKindOverridesClassifier() {
        RunAccumulator run = newRun();
        run.recordNotification(NormalizedEvent.builder("issue_refund").id("c1").kind(ToolKind.WRITE).build());
        assertEquals(1, run.getActions().size());
        assertTrue(run.getEvidence().isEmpty());
    }

    @Test
    void duplicateIdsAreIgnored() {
        RunAccumulator run = newRun();
        assertTrue(run.recordNotification(read("c1", "get_order", "x")));
        assertFalse(run.recordNotification(read("c1", "get_order", "x")));
        assertEquals(1, run.getEvidence().size());
    }

    @Test
    void eventsWithoutIdAreNeverDeduplicated() {
        RunAccumulator run = newRun();
        run.recordNotification(read(null, "get_order", "x"));
        run.recordNotification(read(null, "get_order", "x"));
        assertEquals(2, run.getEvidence().size());
    }

    @Test
    void noActionsMeansNoRecord() {
        RunAccumulator run = newRun();
        run.recordNotification(read("c1", "get_order", "x"));
        assertNull(run.finalizeRecord());
        assertEquals(RunState.FINALIZED, run.getState());
    }

    @Test
    void failedWriteDeniesWithToolReason() {
        RunAccumulator run = newRun();
        run.recordNotification(write("c1", "send_email", "smtp down"));
        run.recordNotification(write("c2", "update_ticket", "ticket locked"));

        DecisionRecord record = run.finalizeRecord();

        assertEquals(Outcome.DENIED, record.getOutcome());
        assertEquals("tool update_ticket failed: ticket locked", record.getOutcomeReason());
        assertFalse(record.getActions().get(0).isSuccess());
    }

    @Test
    void failedPolicyTakesPrecedenceOverFailedWrite() {
        RunAccumulator run = newRun();
        run.recordPolicy("refund-limit", "1.0", PolicyResult.PASS, null);
        run.recordPolicy("fraud-check", "2.1", PolicyResult.FAIL, "Customer flagged");
        run.recordNotification(write("c1", "create_refund", "gateway timeout"));

        DecisionRecord record = run.finalizeRecord();

        assertEquals(Outcome.DENIED, record.getOutcome());
        assertEquals("Customer flagged", record.getOutcomeReason());
        assertEquals(2, record.getPolicies().size());
    }

    @Test
    void reevaluatedPolicyIsRecordedEachTime() {
        RunAccumulator run = newRun();
        run.recordPolicy("refund-limit", "1.0", PolicyResult.FAIL, "Over limit");
        run.recordPolicy("refund-limit", "1.0", PolicyResult.PASS, "Within limit after override");
        run.recordNotification(write("c1", "create_refund", null));

        DecisionRecord record = run.finalizeRecord();

        assertEquals(2, record.getPolicies().size());
        assertEquals(List.of(PolicyResult.FAIL, PolicyResult.PASS),
            List.of(record.getPolicies().get(0).getResult(), record.getPolicies().get(1).getResult()));
        assertEquals("Over limit", record.getOutcomeReason());

        List<PolicyStep> chain = new ExplainService(null).explain(record).getPolicyChain();
        assertEquals(2, chain.size());
        assertEquals(1, chain.get(0).getStep());
        assertEquals(2, chain.get(1).getStep());
        assertEquals("refund-limit", chain.get(1).getPolicyId());
        assertEquals("Within limit after override", chain.get(1).getMessage());
    }

    @Test
    void snapshotIsDetachedFromCallerPayload() {
        List<Object> items = new ArrayList<>(List.of("sku-1"));
        Map<String, Object> customer = new LinkedHashMap<>();
        customer.put("tier", "gold");
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("customer", customer);
        output.put("items", items);

        RunAccumulator run = newRun();
        run.recordNotification(read("c1", "get_order", output));
        run.recordNotification(write("c2", "create_refund", null));
        DecisionRecord record = run.finalizeRecord();

        customer.put("tier", "bronze");
        items.add("sku-2");

        Evidence evidence = record.getEvidence().get(0);
        assertEquals(Map.of("customer", Map.of("tier", "gold"), "items", List.of("sku-1")), evidence.getSnapshot());
        assertEquals(Identifiers.generateHash(evidence.getSnapshot()), evidence.getSnapshotHash());
        assertThrows(UnsupportedOperationException.class, () -> evidence.getSnapshot().put("extra", 1));
        @SuppressWarnings("unchecked")
        Map<String, Object> nested = (Map<String, Object>) evidence.getSnapshot().get("customer");
        assertThrows(UnsupportedOperationException.class, () -> nested.put("tier", "bronze"));
    }

    @Test
    void failedPolicyWithoutMessageNamesThePolicy() {
        RunAccumulator run = newRun();
        run.recordPolicy("fraud-check", "2.1", PolicyResult.FAIL, null);
        run.recordNotification(write("c1", "create_refund", null));

        assertEquals("Blocked by policy fraud-check", run.finalizeRecord().getOutcomeReason());
    }

    @Test
    void denyingSignalWinsOverEverything() {
        RunAccumulator run = newRun();
        run.recordPolicy("fraud-check", "2.1", PolicyResult.FAIL, "Customer flagged");
        run.recordNotification(write("c1", "create_refund", null));

        DecisionRecord record = run.finalizeRecord(TerminalSignal.USER_CANCEL, "user aborted");

        assertEquals(Outcome.DENIED, record.getOutcome());
        assertEquals("user aborted", record.getOutcomeReason());
    }

    @Test
    void denyingSignalFallsBackToSignalName() {
        RunAccumulator run = newRun();
        run.recordNotification(write("c1", "create_refund", null));
        assertEquals("run ended with timeout", run.finalizeRecord(TerminalSignal.TIMEOUT).getOutcomeReason());
    }

    @Test
    void finalizeIsIdempotentAndLaterEventsIgnored() {
        RunAccumulator run = newRun();
        run.recordNotification(write("c1", "create_refund", null));
        DecisionRecord first = run.finalizeRecord();

        assertFalse(run.recordNotification(write("c2", "delete_account", null)));
        run.recordPolicy("late", "1", PolicyResult.FAIL, "too late");

        assertSame(first, run.finalizeRecord(TerminalSignal.ERROR));
        assertEquals(1, first.getActions().size());
        assertTrue(first.getPolicies().isEmpty());
    }

    @Test
    void recordListsAreCopies() {
        RunAccumulator run = newRun();
        run.recordNotification(write("c1", "create_refund", null));
        DecisionRecord record = run.finalizeRecord();
        record.getActions().clear();
        assertEquals(1, run.getActions().size());
    }

    @Test
    void interruptAndResumeRecordApproval() {
        RunAccumulator run = newRun();
        run.onInterrupt(Map.of("question", "Refund $500?"));
        assertEquals(RunState.INTERRUPTED, run.getState());
        assertTrue(run.isPendingInterrupt());

        assertTrue(run.onResume("manager-7", "approved"));
        assertEquals(RunState.ACTIVE, run.getState());
        assertFalse(run.isPendingInterrupt());
        run.recordNotification(write("c1", "create_refund", null));

        DecisionRecord record = run.finalizeRecord();
        Evidence interrupt = record.getEvidence().get(0);
        assertEquals("interrupt", interrupt.getSource());
        assertEquals(Map.of("question", "Refund $500?"), interrupt.getSnapshot());
        assertEquals(1, record.getApprovals().size());
        assertEquals("manager-7", record.getApprovals().get(0).getApprover().getId());
        assertEquals(ActorType.HUMAN, record.getApprovals().get(0).getApprover().getType());
        assertEquals("approved", record.getApprovals().get(0).getReason());
        assertTrue(record.getApprovals().get(0).isGranted());
    }

    @Test
    void resumeWithoutInterruptIsIgnored() {
        RunAccumulator run = newRun();
        assertFalse(run.onResume("manager-7", "approved"));
        assertTrue(run.getApprovals().isEmpty());
    }

    @Test
    void policyCheckVerdictsAreRecorded() {
        RunAccumulator run = newRun();
        PolicyCheck limit = (tool, args) -> ((Integer) args.get("amount")) > 100
            ? PolicyVerdict.fail("Amount over limit")
            : PolicyVerdict.pass();

        assertTrue(run.checkPolicy("refund-limit", "1.0", limit, "create_refund", Map.of("amount", 20)));
        assertFalse(run.checkPolicy("refund-limit", "1.0", limit, "create_refund", Map.of("amount", 500)));

        assertEquals(List.of(PolicyResult.PASS, PolicyResult.FAIL),
            List.of(run.getPolicies().get(0).getResult(), run.getPolicies().get(1).getResult()));
        assertEquals("Amount over limit", run.getPolicies().get(1).getMessage());
    }

    @Test
    void throwingPolicyCheckFailsOpen() {
        RunAccumulator run = newRun();
        PolicyCheck broken = (tool, args) -> {
            throw new IllegalStateException("policy service unreachable");
        };

        assertTrue(run.checkPolicy("fraud-check", "2.1", broken, "create_refund", Map.of()));
        assertEquals(PolicyResult.WARN, run.getPolicies().get(0).getResult());
        assertEquals("policy service unreachable", run.getPolicies().get(0).getMessage());

        run.recordNotification(write("c1", "create_refund", null));
        assertEquals(Outcome.COMMITTED, run.finalizeRecord().getOutcome());
    }

    @Test
    void stopReasonsMapToSignals() {
        assertEquals(TerminalSignal.ERROR, TerminalSignal.fromStopReason("ERROR"));
        assertEquals(TerminalSignal.USER_CANCEL, TerminalSignal.fromStopReason("cancelled"));
        assertEquals(TerminalSignal.COMPLETED, TerminalSignal.fromStopReason("end_turn"));
        assertEquals(TerminalSignal.COMPLETED, TerminalSignal.fromStopReason(null));
    }
}
