package com.reqflow.core.config;

import com.reqflow.core.model.WorkflowPhase;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Effective configuration for one workflow run. Built from {@link ReqflowProperties} and
 * optionally overridden per submission.
 *
 * @param maxConcurrentPerPhase hard ceiling on in-flight handler calls, per phase
 * @param perItemTimeout        timeout for a single handler attempt
 * @param maxAttempts           attempts per work unit on transient failure
 * @param clarificationTimeout  how long a clarification question waits for an answer
 * @param passThreshold         minimum score for a requirement to pass
 * @param retryBackoff          base delay between attempts (multiplied by the attempt number)
 * @param rewriteMaxRounds      rewrite / re-validate rounds per failed requirement
 * @param kgBatchSize           requirements per knowledge-graph build unit
 * @param duplicateThreshold    search similarity at or above which QA flags a duplicate
 * @param searchTopK            hits requested per QA duplicate search
 */
public record WorkflowConfig(
    Map<WorkflowPhase, Integer> maxConcurrentPerPhase,
    Duration perItemTimeout,
    int maxAttempts,
    Duration clarificationTimeout,
    double passThreshold,
    Duration retryBackoff,
    int rewriteMaxRounds,
    int kgBatchSize,
    double duplicateThreshold,
    int searchTopK
) {

    static final int FALLBACK_CONCURRENCY = 4;

    public WorkflowConfig {
        var copy = new EnumMap<WorkflowPhase, Integer>(WorkflowPhase.class);
        if (maxConcurrentPerPhase != null) {
            copy.putAll(maxConcurrentPerPhase);
        }
        copy.values().forEach(v -> requirePositive(v, "maxConcurrent"));
        maxConcurrentPerPhase = Collections.unmodifiableMap(copy);
        requirePositive(maxAttempts, "maxAttempts");
        requirePositive(rewriteMaxRounds, "rewriteMaxRounds");
        requirePositive(kgBatchSize, "kgBatchSize");
        requirePositive(searchTopK, "searchTopK");
        requirePositive(perItemTimeout, "perItemTimeout");
        requirePositive(clarificationTimeout, "clarificationTimeout");
        if (retryBackoff == null || retryBackoff.isNegative()) {
            throw new IllegalArgumentException("retryBackoff must not be negative");
        }
        if (passThreshold < 0.0 || passThreshold > 1.0) {
            throw new IllegalArgumentException("passThreshold must be within [0, 1]: " + passThreshold);
        }
    }

    public int maxConcurrent(WorkflowPhase phase) {
        return maxConcurrentPerPhase.getOrDefault(phase, FALLBACK_CONCURRENCY);
    }

    /**
     * Returns a copy with the non-null fields of {@code overrides} applied.
     */
    public WorkflowConfig withOverrides(Overrides overrides) {
        if (overrides == null) {
            return this;
        }
        var concurrency = new EnumMap<WorkflowPhase, Integer>(WorkflowPhase.class);
        concurrency.putAll(maxConcurrentPerPhase);
        if (overrides.maxConcurrentPerPhase() != null) {
            overrides.maxConcurrentPerPhase().forEach(
                    (key, value) -> concurrency.put(WorkflowPhase.fromConfigKey(key), value));
        }
        return new WorkflowConfig(
                concurrency,
                overrides.perItemTimeout() != null ? overrides.perItemTimeout() : perItemTimeout,
                overrides.maxAttempts() != null ? overrides.maxAttempts() : maxAttempts,
                overrides.clarificationTimeout() != null ? overrides.clarificationTimeout() : clarificationTimeout,
                overrides.passThreshold() != null ? overrides.passThreshold() : passThreshold,
                retryBackoff,
                rewriteMaxRounds,
                kgBatchSize,
                duplicateThreshold,
                searchTopK
        );
    }

    private static void requirePositive(int value, String name) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be at least 1: " + value);
        }
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }

    /**
     * Per-submission overrides of the recognized options. Null fields keep the defaults.
     */
    public record Overrides(
        Map<String, Integer> maxConcurrentPerPhase,
        Duration perItemTimeout,
        Integer maxAttempts,
        Duration clarificationTimeout,
        Double passThreshold
    ) {}
}
