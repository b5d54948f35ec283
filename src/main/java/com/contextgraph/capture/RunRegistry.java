package com.contextgraph.capture;

import com.contextgraph.AppLogger;
import com.contextgraph.client.ContextGraphClient;
import com.contextgraph.models.Actor;
import com.contextgraph.models.DecisionRecord;
import com.contextgraph.tools.ToolClassifier;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live runs of one adapter, keyed by run (thread) id. Finalizing a run removes it
 * and hands the record to the client.
 */
public class RunRegistry {

    private final ContextGraphClient client;
    private final ToolClassifier classifier;
    private final Actor defaultActor;
    private final Clock clock;
    private final AppLogger logger = AppLogger.get();
    private final Map<String, RunAccumulator> runs = new ConcurrentHashMap<>();

    public RunRegistry(ContextGraphClient client, Actor defaultActor) {
        this(client, client.getConfig().toolClassifier(), defaultActor, Clock.systemUTC());
    }

    public RunRegistry(ContextGraphClient client, ToolClassifier classifier, Actor defaultActor, Clock clock) {
        this.client = client;
        this.classifier = classifier != null ? classifier : new ToolClassifier();
        this.defaultActor = defaultActor;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public RunAccumulator accumulator(String runId) {
        return accumulator(runId, defaultActor);
    }

    /**
     * Get or create; {@code actor} only applies to a newly created run.
     */
    public RunAccumulator accumulator(String runId, Actor actor) {
        return runs.computeIfAbsent(runId, id -> new RunAccumulator(id, actor, classifier, clock));
    }

    public RunAccumulator get(String runId) {
        return runs.get(runId);
    }

    public int activeCount() {
        return runs.size();
    }

    public DecisionRecord finalizeRun(String runId, TerminalSignal signal) {
        return finalizeRun(runId, signal, null);
    }

    /**
     * Remove, finalize and ingest. Delivery problems are logged and never reach the
     * caller.
     *
     * @return the record, or null for an unknown run or a run without actions
     */
    public DecisionRecord finalizeRun(String runId, TerminalSignal signal, String reason) {
        RunAccumulator accumulator = runId != null ? runs.remove(runId) : null;
        if (accumulator == null) {
            logger.debug("[RunRegistry] No active run " + runId + " to finalize");
            return null;
        }
        DecisionRecord record = accumulator.finalizeRecord(signal, reason);
        if (record == null) {
            return null;
        }
        try {
            client.ingest(record);
        } catch (RuntimeException e) {
            logger.error("[RunRegistry] Ingest failed for run " + runId + ": " + e.getMessage(), e);
        }
        return record;
    }
}
