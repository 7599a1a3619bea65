package com.reqflow.core.model;

/**
 * Phases of a requirements workflow run.
 * <p>
 * {@link #COMPLETED} and {@link #FAILED} are terminal. {@link #PENDING} is the state of a
 * run that has been registered but whose driver has not started yet.
 */
public enum WorkflowPhase {
    PENDING,
    MINING,
    KG_BUILD,
    VALIDATING,
    REWRITING,
    QA_REVIEW,
    CLARIFICATION,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** Configuration key used in {@code max-concurrent-per-phase}. */
    public String configKey() {
        return name().toLowerCase().replace('_', '-');
    }

    public static WorkflowPhase fromConfigKey(String key) {
        for (WorkflowPhase phase : values()) {
            if (phase.configKey().equalsIgnoreCase(key) || phase.name().equalsIgnoreCase(key)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown workflow phase: " + key);
    }
}
