package com.contextgraph.models;

import java.time.Instant;

public final class EvidenceStep extends ChainStep {

    private final String source;
    private final String tool;
    private final Instant retrievedAt;
    private final String snapshotHash;

    public EvidenceStep(int step, String source, String tool, Instant retrievedAt, String snapshotHash) {
        super(step, "observation", "Read from " + source);
        this.source = source;
        this.tool = tool;
        this.retrievedAt = retrievedAt;
        this.snapshotHash = snapshotHash;
    }

    public String getSource() {
        return source;
    }

    public String getTool() {
        return tool;
    }

    public Instant getRetrievedAt() {
        return retrievedAt;
    }

    public String getSnapshotHash() {
        return snapshotHash;
    }
}
