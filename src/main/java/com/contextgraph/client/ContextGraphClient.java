package com.contextgraph.client;

import com.contextgraph.AppLogger;
import com.contextgraph.models.ActorType;
import com.contextgraph.models.DecisionRecord;
import com.contextgraph.storage.DecisionStore;
import com.contextgraph.storage.JsonStorage;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Delivers finalized decision records and keeps the ones that could not be
 * delivered for a later {@link #retryFailed()}.
 *
 * <p>Several runs may share one client; the failed-queue is guarded by the client's
 * monitor and delivery itself happens outside it.
 */
public class ContextGraphClient implements AutoCloseable {

    private final ClientConfig config;
    private final DecisionSink sink;
    private final Clock clock;
    private final AppLogger logger = AppLogger.get();
    private final Deque<DecisionRecord> failed = new ArrayDeque<>();

    public ContextGraphClient(ClientConfig config, DecisionSink sink) {
        this(config, sink, Clock.systemUTC());
    }

    public ContextGraphClient(ClientConfig config, DecisionSink sink, Clock clock) {
        if (sink == null) {
            throw new IllegalArgumentException("sink is required");
        }
        this.config = config != null ? config : ClientConfig.defaults();
        this.sink = sink;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Client whose sink follows {@link ClientConfig#isLocalMode()}: records go straight
     * into {@code store} in local mode and to the server otherwise.
     *
     * @throws IllegalArgumentException in local mode without a store
     */
    public static ContextGraphClient create(ClientConfig config, DecisionStore store) {
        ClientConfig resolved = config != null ? config : ClientConfig.defaults();
        if (!resolved.isLocalMode()) {
            return remote(resolved);
        }
        if (store == null) {
            throw new IllegalArgumentException("local mode requires a decision store");
        }
        return local(resolved, store);
    }

    /**
     * Client that posts to {@link ClientConfig#getServerUrl()}.
     */
    public static ContextGraphClient remote(ClientConfig config) {
        ClientConfig resolved = config != null ? config : ClientConfig.defaults();
        return new ContextGraphClient(resolved, new HttpDecisionSink(resolved, JsonStorage.mapper()));
    }

    /**
     * Client that writes straight into {@code store}.
     */
    public static ContextGraphClient local(ClientConfig config, DecisionStore store) {
        return new ContextGraphClient(config, new StoreDecisionSink(store));
    }

    /**
     * Deliver one record. A failed delivery is queued for retry; the call then
     * returns false, or throws {@link IngestException} when configured to raise.
     */
    public boolean ingest(DecisionRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record is required");
        }
        try {
            sink.deliver(record);
            logger.debug("[ContextGraphClient] Ingested decision " + record.getDecisionId()
                + " via " + sink.describe());
            return true;
        } catch (Exception e) {
            enqueue(record);
            logger.warn("[ContextGraphClient] Failed to ingest decision " + record.getDecisionId()
                + ": " + e.getMessage());
            if (config.isRaiseOnError()) {
                throw new IngestException(record.getDecisionId(),
                    "Failed to ingest decision " + record.getDecisionId() + ": " + e.getMessage(), e);
            }
            return false;
        }
    }

    /**
     * Re-attempt every queued record once, oldest first.
     *
     * @return how many were delivered
     */
    public int retryFailed() {
        List<DecisionRecord> pending;
        synchronized (this) {
            if (failed.isEmpty()) {
                return 0;
            }
            pending = new ArrayList<>(failed);
            failed.clear();
        }

        int succeeded = 0;
        List<DecisionRecord> stillFailed = new ArrayList<>();
        for (DecisionRecord record : pending) {
            try {
                sink.deliver(record);
                succeeded++;
            } catch (Exception e) {
                stillFailed.add(record);
                logger.debug("[ContextGraphClient] Retry failed for decision " + record.getDecisionId()
                    + ": " + e.getMessage());
            }
        }

        synchronized (this) {
            for (int i = stillFailed.size() - 1; i >= 0; i--) {
                failed.addFirst(stillFailed.get(i));
            }
            trimToCapacity();
        }
        logger.info("[ContextGraphClient] Retried " + pending.size() + " decisions, " + succeeded + " succeeded");
        return succeeded;
    }

    public synchronized int failedCount() {
        return failed.size();
    }

    /**
     * Snapshot of the failed-queue, oldest first.
     */
    public synchronized List<DecisionRecord> failedRecords() {
        return new ArrayList<>(failed);
    }

    public DecisionRecordBuilder startDecision(String runId, String actorId, ActorType actorType) {
        return new DecisionRecordBuilder(this, runId, actorId,
            actorType != null ? actorType : ActorType.AGENT, clock);
    }

    public DecisionRecordBuilder startDecision(String runId, String actorId) {
        return startDecision(runId, actorId, ActorType.AGENT);
    }

    public ClientConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        int remaining = failedCount();
        if (remaining > 0) {
            logger.warn("[ContextGraphClient] Closing with " + remaining + " undelivered decisions");
        }
    }

    private synchronized void enqueue(DecisionRecord record) {
        failed.addLast(record);
        trimToCapacity();
    }

    private void trimToCapacity() {
        while (failed.size() > config.getMaxFailedQueue()) {
            DecisionRecord dropped = failed.pollFirst();
            logger.warn("[ContextGraphClient] Failed-queue full, dropping decision "
                + (dropped != null ? dropped.getDecisionId() : null));
        }
    }
}
