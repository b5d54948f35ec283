package com.contextgraph.client;

import com.contextgraph.models.DecisionRecord;
import com.contextgraph.models.Outcome;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ContextGraphClientTest {

    private static DecisionRecord record(String runId) {
        return new DecisionRecord(runId, Outcome.COMMITTED, Instant.parse("2024-05-01T10:00:00Z"));
    }

    @Test
    void successfulIngestDelivers() {
        RecordingSink sink = new RecordingSink();
        ContextGraphClient client = new ContextGraphClient(ClientConfig.defaults(), sink);

        assertTrue(client.ingest(record("run-1")));
        assertEquals(1, sink.getDelivered().size());
        assertEquals(0, client.failedCount());
    }

    @Test
    void failedIngestIsQueuedAndRetried() {
        RecordingSink sink = new RecordingSink();
        sink.setAvailable(false);
        ContextGraphClient client = new ContextGraphClient(ClientConfig.defaults(), sink);

        assertFalse(client.ingest(record("run-1")));
        assertFalse(client.ingest(record("run-2")));
        assertEquals(2, client.failedCount());
        assertEquals(0, client.retryFailed());
        assertEquals(2, client.failedCount());

        sink.setAvailable(true);
        assertEquals(2, client.retryFailed());
        assertEquals(0, client.failedCount());
        assertEquals(List.of("run-1", "run-2"),
            sink.getDelivered().stream().map(DecisionRecord::getRunId).collect(Collectors.toList()));
    }

    @Test
    void fullQueueDropsOldest() {
        RecordingSink sink = new RecordingSink();
        sink.setAvailable(false);
        ContextGraphClient client = new ContextGraphClient(
            ClientConfig.builder().maxFailedQueue(2).build(), sink);

        client.ingest(record("run-1"));
        client.ingest(record("run-2"));
        client.ingest(record("run-3"));

        assertEquals(List.of("run-2", "run-3"),
            client.failedRecords().stream().map(DecisionRecord::getRunId).collect(Collectors.toList()));
    }

    @Test
    void raiseOnErrorThrowsButStillQueues() {
        RecordingSink sink = new RecordingSink();
        sink.setAvailable(false);
        ContextGraphClient client = new ContextGraphClient(
            ClientConfig.builder().raiseOnError(true).build(), sink);
        DecisionRecord record = record("run-1");

        IngestException e = assertThrows(IngestException.class, () -> client.ingest(record));
        assertEquals(record.getDecisionId(), e.getDecisionId());
        assertEquals(1, client.failedCount());
    }

    @Test
    void configDefaults() {
        ClientConfig config = ClientConfig.defaults();
        assertEquals("http://localhost:8080", config.getServerUrl());
        assertEquals(1000, config.getMaxFailedQueue());
        assertEquals(30, config.getTimeout().getSeconds());
        assertFalse(config.isRaiseOnError());
        assertThrows(IllegalArgumentException.class, () -> ClientConfig.builder().maxFailedQueue(0));
    }

    @Test
    void environmentOverridesServer() {
        ClientConfig config = ClientConfig.builder()
            .fromEnvironment(java.util.Map.of(ClientConfig.ENV_SERVER_URL, "https://cg.example.com/",
                ClientConfig.ENV_API_KEY, "secret"))
            .build();
        assertEquals("https://cg.example.com/", config.getServerUrl());
        assertEquals("secret", config.getApiKey());
        assertEquals("https://cg.example.com/v1/decisions",
            new HttpDecisionSink(config, com.contextgraph.storage.JsonStorage.mapper()).getEndpoint());
    }
}
