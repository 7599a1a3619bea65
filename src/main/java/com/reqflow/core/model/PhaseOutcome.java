package com.reqflow.core.model;

import java.io.Serializable;

/**
 * Result of one phase for one work unit. Written once per (item, phase) pair.
 *
 * @param phase    the phase that produced this outcome
 * @param score    quality score, when the phase produces one (nullable)
 * @param verdict  pass, fail or error
 * @param detail   human-readable detail (feedback, error message, improvement summary)
 * @param attempts number of handler attempts used, including the successful one
 */
public record PhaseOutcome(
    WorkflowPhase phase,
    Double score,
    Verdict verdict,
    String detail,
    int attempts
) implements Serializable {

    public boolean isError() {
        return verdict == Verdict.ERROR;
    }
}
