package com.reqflow.core.pool;

/**
 * Per-attempt context handed to a {@link PhaseHandler}.
 *
 * @param poolName the pool (phase) label, for logging
 * @param itemId   id of the work unit
 * @param attempt  1-based attempt number
 * @param token    cancelled on run cancellation or when this attempt times out
 */
public record HandlerContext(
    String poolName,
    String itemId,
    int attempt,
    CancellationToken token
) {}
