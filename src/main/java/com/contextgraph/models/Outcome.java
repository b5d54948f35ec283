package com.contextgraph.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Terminal result of a run. Decided once, at finalization.
 */
public enum Outcome {
    COMMITTED("committed"),
    DENIED("denied"),
    ESCALATED("escalated"),
    PENDING("pending");

    private final String value;

    Outcome(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Outcome fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase();
        for (Outcome candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown outcome: " + raw);
    }

    @Override
    public String toString() {
        return value;
    }
}
