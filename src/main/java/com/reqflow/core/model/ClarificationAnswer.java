package com.reqflow.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Resolution of a clarification question.
 *
 * @param questionId the question this answers
 * @param value      the answer text; {@link #MANUAL_REVIEW} when defaulted
 * @param answeredAt when the answer was accepted
 * @param defaulted  true when the question timed out and the default answer was applied
 */
public record ClarificationAnswer(
    String questionId,
    String value,
    Instant answeredAt,
    boolean defaulted
) implements Serializable {

    public static final String MANUAL_REVIEW = "manual-review";

    public static ClarificationAnswer defaultFor(String questionId, Instant at) {
        return new ClarificationAnswer(questionId, MANUAL_REVIEW, at, true);
    }
}
