package com.contextgraph.client;

import com.contextgraph.models.ActorType;
import com.contextgraph.models.DecisionRecord;
import com.contextgraph.models.Outcome;
import com.contextgraph.models.PolicyResult;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DecisionRecordBuilderTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void commitBuildsAndIngests() {
        RecordingSink sink = new RecordingSink();
        ContextGraphClient client = new ContextGraphClient(ClientConfig.defaults(), sink,
            Clock.fixed(NOW, ZoneOffset.UTC));

        DecisionRecord record = client.startDecision("run-7", "refund-agent")
            .addEvidence("get_order", Map.of("id", "o-1"), "shipped")
            .addPolicy("refund-limit", "1.0", PolicyResult.PASS, null)
            .addApproval("manager-7", true, "ok")
            .addAction("create_refund", Map.of("amount", 20), Map.of("refund_id", "r-1"), true)
            .metadata("channel", "email")
            .commit(Outcome.COMMITTED, null);

        assertSame(record, sink.getDelivered().get(0));
        assertEquals("run-7", record.getRunId());
        assertEquals(NOW, record.getTimestamp());
        assertEquals(ActorType.AGENT, record.getActor().getType());
        assertEquals("refund-agent", record.getActor().getId());
        assertEquals("get_order", record.getEvidence().get(0).getSource());
        assertEquals(Map.of("value", "shipped"), record.getEvidence().get(0).getSnapshot());
        assertEquals(Map.of("refund_id", "r-1"), record.getActions().get(0).getResult());
        assertEquals("manager-7", record.getApprovals().get(0).getApprover().getId());
        assertEquals("email", record.getMetadata().get("channel"));
    }

    @Test
    void explicitSourceOverridesToolName() {
        ContextGraphClient client = new ContextGraphClient(ClientConfig.defaults(), new RecordingSink());
        DecisionRecord record = client.startDecision("run-8", null, ActorType.SYSTEM)
            .addEvidence("search_kb", Map.of(), null, "knowledge-base")
            .build(Outcome.ESCALATED, "needs review");

        assertNull(record.getActor());
        assertEquals("knowledge-base", record.getEvidence().get(0).getSource());
        assertEquals("search_kb", record.getEvidence().get(0).getToolName());
        assertEquals(Outcome.ESCALATED, record.getOutcome());
        assertEquals("needs review", record.getOutcomeReason());
    }
}
