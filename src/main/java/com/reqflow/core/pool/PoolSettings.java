package com.reqflow.core.pool;

import java.time.Duration;

/**
 * Limits applied to one {@link WorkerPool#run} call.
 *
 * @param name           label for threads and logs (usually the phase)
 * @param maxConcurrent  hard ceiling on in-flight handler invocations
 * @param perItemTimeout timeout of a single attempt
 * @param maxAttempts    attempts per unit on transient failure
 * @param retryBackoff   delay before attempt n+1 is {@code retryBackoff * n}
 */
public record PoolSettings(
    String name,
    int maxConcurrent,
    Duration perItemTimeout,
    int maxAttempts,
    Duration retryBackoff
) {

    public PoolSettings {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1: " + maxConcurrent);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        if (perItemTimeout == null || perItemTimeout.isZero() || perItemTimeout.isNegative()) {
            throw new IllegalArgumentException("perItemTimeout must be positive: " + perItemTimeout);
        }
        retryBackoff = retryBackoff != null ? retryBackoff : Duration.ZERO;
    }
}
