package com.contextgraph.client;

import com.contextgraph.Main;
import com.contextgraph.models.Actor;
import com.contextgraph.models.DecisionRecord;
import com.contextgraph.models.Outcome;
import com.contextgraph.storage.FileDecisionStore;
import com.contextgraph.storage.JsonStorage;
import io.javalin.Javalin;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class HttpDecisionSinkTest {

    @TempDir
    Path dataDir;

    @Test
    void deliversToRunningServer() throws Exception {
        FileDecisionStore store = new FileDecisionStore(dataDir, JsonStorage.mapper());
        Javalin app = Main.createApp(store, JsonStorage.mapper()).start(0);
        try {
            ClientConfig config = ClientConfig.builder()
                .serverUrl("http://localhost:" + app.port() + "/")
                .timeout(Duration.ofSeconds(5))
                .build();
            ContextGraphClient client = ContextGraphClient.remote(config);
            DecisionRecord record = new DecisionRecord("run-1", Outcome.COMMITTED, Instant.parse("2024-05-01T10:00:00Z"));
            record.setActor(Actor.agent("bot"));

            assertTrue(client.ingest(record));
            assertEquals("run-1", store.get(record.getDecisionId()).getRunId());
        } finally {
            app.stop();
        }
    }

    @Test
    void rejectedRecordIsQueued() throws Exception {
        FileDecisionStore store = new FileDecisionStore(dataDir, JsonStorage.mapper());
        Javalin app = Main.createApp(store, JsonStorage.mapper()).start(0);
        try {
            ClientConfig config = ClientConfig.builder().serverUrl("http://localhost:" + app.port()).build();
            ContextGraphClient client = ContextGraphClient.remote(config);
            DecisionRecord incomplete = new DecisionRecord(null, Outcome.COMMITTED, Instant.now());

            assertFalse(client.ingest(incomplete));
            assertEquals(1, client.failedCount());
        } finally {
            app.stop();
        }
    }

    @Test
    void localModeWritesToStore() throws Exception {
        FileDecisionStore store = new FileDecisionStore(dataDir, JsonStorage.mapper());
        ContextGraphClient client = ContextGraphClient.create(ClientConfig.builder().localMode(true).build(), store);
        DecisionRecord record = new DecisionRecord("run-2", Outcome.DENIED, Instant.now());

        assertTrue(client.ingest(record));
        assertEquals(Outcome.DENIED, store.get(record.getDecisionId()).getOutcome());
        assertFalse(client.ingest(new DecisionRecord("run-3", null, Instant.now())));
    }

    @Test
    void createPostsToServerWhenNotLocal() throws Exception {
        FileDecisionStore serverStore = new FileDecisionStore(dataDir.resolve("server"), JsonStorage.mapper());
        FileDecisionStore localStore = new FileDecisionStore(dataDir.resolve("local"), JsonStorage.mapper());
        Javalin app = Main.createApp(serverStore, JsonStorage.mapper()).start(0);
        try {
            ClientConfig config = ClientConfig.builder().serverUrl("http://localhost:" + app.port()).build();
            ContextGraphClient client = ContextGraphClient.create(config, localStore);
            DecisionRecord record = new DecisionRecord("run-4", Outcome.COMMITTED, Instant.now());

            assertTrue(client.ingest(record));
            assertNotNull(serverStore.get(record.getDecisionId()));
            assertNull(localStore.get(record.getDecisionId()));
        } finally {
            app.stop();
        }
    }

    @Test
    void localModeWithoutStoreIsRejected() {
        ClientConfig config = ClientConfig.builder().localMode(true).build();

        assertThrows(IllegalArgumentException.class, () -> ContextGraphClient.create(config, null));
    }
}
