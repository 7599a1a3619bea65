package com.reqflow.core.delegator;

import com.reqflow.core.model.PhaseOutcome;

/**
 * Receives each work unit's outcome on the worker thread that produced it.
 *
 * @param <R> handler result type; {@code payload} is null for error outcomes
 */
@FunctionalInterface
public interface OutcomeListener<R> {

    void onOutcome(String unitId, PhaseOutcome outcome, R payload);

    static <R> OutcomeListener<R> none() {
        return (unitId, outcome, payload) -> {};
    }
}
