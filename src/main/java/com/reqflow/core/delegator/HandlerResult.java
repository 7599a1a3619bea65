package com.reqflow.core.delegator;

import com.reqflow.core.model.Verdict;

/**
 * What a phase handler reports back for one work unit. The delegator turns it into a
 * {@link com.reqflow.core.model.PhaseOutcome}.
 */
public interface HandlerResult {

    Verdict verdict();

    /** Score produced by the phase, or null when the phase does not score. */
    Double score();

    String detail();

    default boolean improved() {
        return false;
    }
}
