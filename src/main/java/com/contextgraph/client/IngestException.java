package com.contextgraph.client;

/**
 * Raised by {@link ContextGraphClient#ingest} when the client is configured to
 * surface delivery failures instead of returning false.
 */
public class IngestException extends RuntimeException {

    private final String decisionId;

    public IngestException(String decisionId, String message, Throwable cause) {
        super(message, cause);
        this.decisionId = decisionId;
    }

    public String getDecisionId() {
        return decisionId;
    }
}
