package com.contextgraph.capture;

/**
 * Result handed back by an external policy check.
 */
public final class PolicyVerdict {

    private final boolean passed;
    private final String message;

    private PolicyVerdict(boolean passed, String message) {
        this.passed = passed;
        this.message = message;
    }

    public static PolicyVerdict pass() {
        return new PolicyVerdict(true, null);
    }

    public static PolicyVerdict pass(String message) {
        return new PolicyVerdict(true, message);
    }

    public static PolicyVerdict fail(String message) {
        return new PolicyVerdict(false, message);
    }

    public boolean isPassed() {
        return passed;
    }

    public String getMessage() {
        return message;
    }
}
