package com.contextgraph.capture;

/**
 * How a run ended, as reported by the host framework or the caller.
 * Every signal other than {@link #COMPLETED} denies the run outright.
 */
public enum TerminalSignal {
    COMPLETED("completed"),
    ERROR("error"),
    TOOL_ERROR("tool_error"),
    USER_CANCEL("user_cancel"),
    TIMEOUT("timeout");

    private final String value;

    TerminalSignal(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isDenial() {
        return this != COMPLETED;
    }

    /**
     * Maps host stop reasons such as {@code "ERROR"} or {@code "user_cancel"}; unknown
     * reasons count as a normal completion.
     */
    public static TerminalSignal fromStopReason(String stopReason) {
        if (stopReason == null || stopReason.isBlank()) {
            return COMPLETED;
        }
        String normalized = stopReason.trim().toLowerCase();
        for (TerminalSignal signal : values()) {
            if (signal.value.equals(normalized)) {
                return signal;
            }
        }
        if ("cancelled".equals(normalized) || "canceled".equals(normalized)) {
            return USER_CANCEL;
        }
        return COMPLETED;
    }
}
