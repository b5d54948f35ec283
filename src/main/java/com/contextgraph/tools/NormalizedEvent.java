package com.contextgraph.tools;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical tool-call notification consumed by the run accumulator.
 * Adapters translate whatever their host framework delivers into this shape.
 *
 * <p>{@code kind} may be null, in which case the accumulator classifies the tool by
 * name. {@code id} should be stable across re-deliveries of the same call so that
 * duplicates collapse.
 */
public final class NormalizedEvent {

    private final ToolKind kind;
    private final String id;
    private final String toolName;
    private final Map<String, Object> args;
    private final Object output;
    private final String error;
    private final Instant timestamp;

    private NormalizedEvent(Builder builder) {
        this.kind = builder.kind;
        this.id = builder.id;
        this.toolName = builder.toolName;
        this.args = builder.args != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.args))
            : Map.of();
        this.output = builder.output;
        this.error = builder.error;
        this.timestamp = builder.timestamp;
    }

    public static Builder builder(String toolName) {
        return new Builder(toolName);
    }

    public ToolKind getKind() {
        return kind;
    }

    public String getId() {
        return id;
    }

    public String getToolName() {
        return toolName;
    }

    public Map<String, Object> getArgs() {
        return args;
    }

    public Object getOutput() {
        return output;
    }

    public String getError() {
        return error;
    }

    public boolean hasError() {
        return error != null;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public static final class Builder {
        private final String toolName;
        private ToolKind kind;
        private String id;
        private Map<String, Object> args;
        private Object output;
        private String error;
        private Instant timestamp;

        private Builder(String toolName) {
            if (toolName == null || toolName.isBlank()) {
                throw new IllegalArgumentException("tool_name is required");
            }
            this.toolName = toolName;
        }

        public Builder kind(ToolKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder args(Map<String, Object> args) {
            this.args = args;
            return this;
        }

        public Builder output(Object output) {
            this.output = output;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public NormalizedEvent build() {
            return new NormalizedEvent(this);
        }
    }
}
