package com.reqflow.core.model;

import java.io.Serializable;

/**
 * Aggregate statistics for one phase.
 *
 * @param total    number of work units in the phase
 * @param passed   units with verdict pass
 * @param failed   units with verdict fail
 * @param errored  units with verdict error
 * @param improved units whose score improved during the phase
 * @param avgScore mean score over non-error units that carry a score (0.0 when there are none)
 */
public record PhaseStats(
    int total,
    int passed,
    int failed,
    int errored,
    int improved,
    double avgScore
) implements Serializable {

    public static PhaseStats empty() {
        return new PhaseStats(0, 0, 0, 0, 0, 0.0);
    }

    public boolean allErrored() {
        return total > 0 && errored == total;
    }
}
