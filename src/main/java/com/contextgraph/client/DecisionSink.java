package com.contextgraph.client;

import com.contextgraph.models.DecisionRecord;

import java.io.IOException;

/**
 * Destination for finalized decision records.
 */
public interface DecisionSink {

    void deliver(DecisionRecord record) throws IOException;

    default String describe() {
        return getClass().getSimpleName();
    }
}
