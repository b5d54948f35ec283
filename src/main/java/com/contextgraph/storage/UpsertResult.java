package com.contextgraph.storage;

public enum UpsertResult {
    CREATED("created"),
    UPDATED("updated");

    private final String value;

    UpsertResult(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
