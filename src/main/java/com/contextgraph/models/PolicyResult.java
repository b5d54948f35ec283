package com.contextgraph.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PolicyResult {
    PASS("pass"),
    FAIL("fail"),
    WARN("warn"),
    SKIP("skip");

    private final String value;

    PolicyResult(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PolicyResult fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase();
        for (PolicyResult candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown policy result: " + raw);
    }

    @Override
    public String toString() {
        return value;
    }
}
