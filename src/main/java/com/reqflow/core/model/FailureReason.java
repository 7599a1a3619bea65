package com.reqflow.core.model;

/**
 * Why a workflow run ended in {@link WorkflowPhase#FAILED}.
 */
public enum FailureReason {
    CANCELLED,
    PHASE_EXHAUSTED,
    NO_REQUIREMENTS,
    INTERNAL_ERROR
}
