package com.reqflow.core.pool;

/**
 * Why a work unit ended without a result.
 */
public enum FailureKind {
    /** Handler signalled a non-retryable failure. */
    FATAL,
    /** Every attempt failed with a transient error. */
    RETRIES_EXHAUSTED,
    /** The last attempt exceeded the per-item timeout. */
    TIMEOUT,
    /** The run was cancelled before or during the unit. */
    CANCELLED
}
