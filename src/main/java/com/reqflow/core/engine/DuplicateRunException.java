package com.reqflow.core.engine;

/**
 * A run with the same correlation id is still active.
 */
public class DuplicateRunException extends RuntimeException {

    private final String correlationId;

    public DuplicateRunException(String correlationId) {
        super("Workflow " + correlationId + " is already running");
        this.correlationId = correlationId;
    }

    public String getCorrelationId() {
        return correlationId;
    }
}
