package com.contextgraph;

import com.contextgraph.models.Action;
import com.contextgraph.models.Actor;
import com.contextgraph.models.Approval;
import com.contextgraph.models.DecisionRecord;
import com.contextgraph.models.Evidence;
import com.contextgraph.models.Explanation;
import com.contextgraph.models.Outcome;
import com.contextgraph.models.PolicyEval;
import com.contextgraph.models.PolicyResult;
import com.contextgraph.storage.FileDecisionStore;
import com.contextgraph.storage.JsonStorage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExplainServiceTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path dataDir;

    private static DecisionRecord refundRecord() {
        DecisionRecord record = new DecisionRecord("run-1", Outcome.COMMITTED, T0);
        Evidence evidence = new Evidence("get_order", T0);
        evidence.setToolName("get_order");
        evidence.setSnapshot(Map.of("total", 42));
        record.setEvidence(List.of(evidence));
        record.setPolicies(List.of(new PolicyEval("refund-limit", "1.0", PolicyResult.PASS, null)));
        record.setActions(List.of(new Action("create_refund", T0, Map.of("amount", 20), null, true)));
        return record;
    }

    @Test
    void summarizesCommittedRun() {
        Explanation explanation = new ExplainService(null).explain(refundRecord());

        assertEquals("Gathered 1 pieces of evidence. Evaluated 1 policies (1 passed). "
            + "Executed 1/1 actions. Outcome: committed.", explanation.getSummary());
        assertEquals("Read from get_order", explanation.getEvidenceChain().get(0).getSummary());
        assertEquals("observation", explanation.getEvidenceChain().get(0).getType());
        assertEquals("get_order", explanation.getEvidenceChain().get(0).getTool());
        assertEquals("Policy refund-limit pass", explanation.getPolicyChain().get(0).getSummary());
        assertEquals("Executed create_refund", explanation.getActionChain().get(0).getSummary());
        assertTrue(explanation.getApprovalChain().isEmpty());
    }

    @Test
    void namespacedToolScenario() {
        DecisionRecord record = new DecisionRecord("run-4", Outcome.COMMITTED, T0);
        record.setEvidence(List.of(new Evidence("crm", T0)));
        record.setPolicies(List.of(new PolicyEval("credit-cap", "1", PolicyResult.PASS, null)));
        record.setActions(List.of(new Action("billing.create_credit", T0, Map.of(), null, true)));

        assertEquals("Gathered 1 pieces of evidence. Evaluated 1 policies (1 passed). "
            + "Executed 1/1 actions. Outcome: committed.", ExplainService.summarize(record));
    }

    @Test
    void countsPartialSuccess() {
        DecisionRecord record = new DecisionRecord("run-2", Outcome.DENIED, T0);
        record.setPolicies(List.of(
            new PolicyEval("refund-limit", "1.0", PolicyResult.PASS, null),
            new PolicyEval("fraud-check", "2.1", PolicyResult.FAIL, "Customer flagged")));
        record.setApprovals(List.of(
            new Approval(Actor.human("manager-7"), true, T0, null),
            new Approval(Actor.human("manager-8"), false, T0, "no")));
        record.setActions(List.of(
            new Action("create_refund", T0, Map.of(), null, true),
            new Action("send_email", T0, Map.of(), null, false)));

        Explanation explanation = new ExplainService(null).explain(record);

        assertEquals("Evaluated 2 policies (1 passed). Received 1/2 approvals. Executed 1/2 actions. "
            + "Outcome: denied.", explanation.getSummary());
        assertEquals(2, explanation.getPolicyChain().get(1).getStep());
        assertEquals("Approved by manager-7", explanation.getApprovalChain().get(0).getSummary());
        assertEquals("Denied by manager-8", explanation.getApprovalChain().get(1).getSummary());
    }

    @Test
    void emptyRecordOnlyReportsOutcome() {
        DecisionRecord record = new DecisionRecord("run-3", Outcome.PENDING, T0);
        assertEquals("Outcome: pending.", new ExplainService(null).explain(record).getSummary());
    }

    @Test
    void explainsStoredRecordById() throws Exception {
        FileDecisionStore store = new FileDecisionStore(dataDir, JsonStorage.mapper());
        DecisionRecord record = refundRecord();
        store.upsert(record);
        ExplainService service = new ExplainService(store);

        Explanation explanation = service.explain(record.getDecisionId());
        assertEquals(record.getDecisionId(), explanation.getDecisionId());
        assertEquals(record.getEvidence().get(0).getSnapshotHash(),
            explanation.getEvidenceChain().get(0).getSnapshotHash());
        assertNull(service.explain("missing"));
    }
}
