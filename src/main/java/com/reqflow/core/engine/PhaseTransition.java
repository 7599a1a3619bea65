package com.reqflow.core.engine;

import com.reqflow.core.model.FailureReason;
import com.reqflow.core.model.WorkflowPhase;

/**
 * The phase a run moves to next. {@code reason} and {@code detail} are set only when
 * {@code next} is {@link WorkflowPhase#FAILED}.
 */
public record PhaseTransition(WorkflowPhase next, FailureReason reason, String detail) {

    static PhaseTransition to(WorkflowPhase next) {
        return new PhaseTransition(next, null, null);
    }

    static PhaseTransition fail(FailureReason reason, String detail) {
        return new PhaseTransition(WorkflowPhase.FAILED, reason, detail);
    }

    public boolean isFailure() {
        return next == WorkflowPhase.FAILED;
    }
}
