package com.reqflow.core.pool;

/**
 * Thrown at a cancellation checkpoint once the owning run has been cancelled.
 */
public class WorkflowCancelledException extends RuntimeException {

    public WorkflowCancelledException(String message) {
        super(message);
    }
}
