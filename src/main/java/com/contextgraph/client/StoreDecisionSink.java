package com.contextgraph.client;

import com.contextgraph.models.DecisionRecord;
import com.contextgraph.storage.DecisionStore;

import java.io.IOException;

/**
 * Local mode: records go straight into a {@link DecisionStore} without a server.
 */
public class StoreDecisionSink implements DecisionSink {

    private final DecisionStore store;

    public StoreDecisionSink(DecisionStore store) {
        this.store = store;
    }

    @Override
    public void deliver(DecisionRecord record) throws IOException {
        try {
            store.upsert(record);
        } catch (IllegalArgumentException e) {
            throw new IOException("Rejected decision " + record.getDecisionId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return "store " + store.describe();
    }
}
