package com.reqflow.core.pool;

/**
 * Result of one work unit: either a value or a failure, plus the attempts used.
 */
public record ItemResult<R>(
    String id,
    R value,
    FailureKind failure,
    String error,
    int attempts,
    long elapsedMs
) {

    public static <R> ItemResult<R> success(String id, R value, int attempts, long elapsedMs) {
        return new ItemResult<>(id, value, null, null, attempts, elapsedMs);
    }

    public static <R> ItemResult<R> failure(String id, FailureKind kind, String error, int attempts, long elapsedMs) {
        return new ItemResult<>(id, null, kind, error, attempts, elapsedMs);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
