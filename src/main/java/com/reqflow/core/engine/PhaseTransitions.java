package com.reqflow.core.engine;

import com.reqflow.core.model.FailureReason;
import com.reqflow.core.model.PhaseStats;
import com.reqflow.core.model.WorkflowPhase;

/**
 * The workflow state machine as a pure function of the finished phase's statistics.
 * <pre>
 * PENDING -> MINING -> KG_BUILD -> VALIDATING -> [REWRITING] -> QA_REVIEW -> [CLARIFICATION] -> COMPLETED
 * </pre>
 * Rewriting is entered iff validation failed at least one requirement; clarification iff QA
 * review flagged at least one. A phase whose every unit errored fails the run, as does a
 * mining phase that leaves the run without requirements.
 */
public final class PhaseTransitions {

    private PhaseTransitions() {}

    /**
     * @param current   the phase that just finished
     * @param stats     its statistics
     * @param itemCount requirements the run holds after the phase
     * @throws IllegalStateException if {@code current} is terminal
     */
    public static PhaseTransition next(WorkflowPhase current, PhaseStats stats, int itemCount) {
        if (current.isTerminal()) {
            throw new IllegalStateException("No transition out of terminal phase " + current);
        }
        if (current == WorkflowPhase.PENDING) {
            return PhaseTransition.to(WorkflowPhase.MINING);
        }
        if (stats.allErrored()) {
            return PhaseTransition.fail(FailureReason.PHASE_EXHAUSTED,
                    "All " + stats.total() + " unit(s) of phase " + current.configKey() + " errored");
        }
        return switch (current) {
            case MINING -> itemCount == 0
                    ? PhaseTransition.fail(FailureReason.NO_REQUIREMENTS, "No requirements after mining")
                    : PhaseTransition.to(WorkflowPhase.KG_BUILD);
            case KG_BUILD -> PhaseTransition.to(WorkflowPhase.VALIDATING);
            case VALIDATING -> PhaseTransition.to(stats.failed() > 0 ? WorkflowPhase.REWRITING : WorkflowPhase.QA_REVIEW);
            case REWRITING -> PhaseTransition.to(WorkflowPhase.QA_REVIEW);
            case QA_REVIEW -> PhaseTransition.to(stats.failed() > 0 ? WorkflowPhase.CLARIFICATION : WorkflowPhase.COMPLETED);
            case CLARIFICATION -> PhaseTransition.to(WorkflowPhase.COMPLETED);
            default -> throw new IllegalStateException("Unexpected phase " + current);
        };
    }
}
