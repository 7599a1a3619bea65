package com.reqflow.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable outcome of one phase, built once by the result aggregator.
 * <p>
 * {@code outcomes} holds one entry per input work unit, keyed by id, in input order.
 * {@code payloads} holds the handler result for every unit that completed without error.
 *
 * @param <R> handler result type of the phase
 */
public record PhaseResult<R>(
    WorkflowPhase phase,
    Map<String, PhaseOutcome> outcomes,
    Map<String, R> payloads,
    PhaseStats stats
) {

    public PhaseResult {
        outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
        payloads = Collections.unmodifiableMap(new LinkedHashMap<>(payloads));
    }

    public static <R> PhaseResult<R> empty(WorkflowPhase phase) {
        return new PhaseResult<>(phase, Map.of(), Map.of(), PhaseStats.empty());
    }
}
