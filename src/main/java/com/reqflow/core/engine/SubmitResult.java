package com.reqflow.core.engine;

import com.reqflow.core.model.WorkflowSnapshot;

import java.util.concurrent.CompletableFuture;

/**
 * Answer to a submission: accepted with a handle on the final snapshot, or rejected because
 * the correlation id is already running.
 */
public record SubmitResult(Status status, String correlationId, CompletableFuture<WorkflowSnapshot> completion) {

    public enum Status {
        ACCEPTED,
        REJECTED_DUPLICATE
    }

    static SubmitResult accepted(String correlationId, CompletableFuture<WorkflowSnapshot> completion) {
        return new SubmitResult(Status.ACCEPTED, correlationId, completion);
    }

    static SubmitResult rejected(String correlationId) {
        return new SubmitResult(Status.REJECTED_DUPLICATE, correlationId, null);
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }
}
