package com.reqflow.core.engine;

import com.reqflow.core.model.PhaseStats;
import com.reqflow.core.model.WorkflowPhase;

/**
 * Every work unit of a phase ended in error; the run cannot continue.
 */
public class PhaseExhaustedException extends RuntimeException {

    private final WorkflowPhase phase;
    private final PhaseStats stats;

    public PhaseExhaustedException(WorkflowPhase phase, PhaseStats stats, String message) {
        super(message);
        this.phase = phase;
        this.stats = stats;
    }

    public WorkflowPhase getPhase() {
        return phase;
    }

    public PhaseStats getStats() {
        return stats;
    }
}
