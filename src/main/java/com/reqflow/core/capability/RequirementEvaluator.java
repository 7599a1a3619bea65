package com.reqflow.core.capability;

import com.reqflow.core.model.Evaluation;

/**
 * Scores a requirement text against the quality criteria.
 * <p>
 * Implementations throw {@link TransientCallException} for failures worth retrying
 * (network, rate limit, empty response) and {@link FatalCallException} for malformed input
 * or output.
 */
public interface RequirementEvaluator {

    Evaluation evaluate(String text);
}
