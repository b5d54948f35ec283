package com.contextgraph.models;

import java.time.Instant;

public final class ActionStep extends ChainStep {

    private final String tool;
    private final String operation;
    private final Instant committedAt;
    private final boolean success;

    public ActionStep(int step, String tool, String operation, Instant committedAt, boolean success) {
        super(step, "action", "Executed " + tool);
        this.tool = tool;
        this.operation = operation;
        this.committedAt = committedAt;
        this.success = success;
    }

    public String getTool() {
        return tool;
    }

    public String getOperation() {
        return operation;
    }

    public Instant getCommittedAt() {
        return committedAt;
    }

    public boolean isSuccess() {
        return success;
    }
}
