package com.contextgraph.models;

/**
 * One numbered step of an explain chain. Steps are numbered from 1 in the order
 * the source entries appear in the record.
 */
public abstract class ChainStep {

    private final int step;
    private final String type;
    private final String summary;

    protected ChainStep(int step, String type, String summary) {
        this.step = step;
        this.type = type;
        this.summary = summary;
    }

    public int getStep() {
        return step;
    }

    public String getType() {
        return type;
    }

    public String getSummary() {
        return summary;
    }
}
