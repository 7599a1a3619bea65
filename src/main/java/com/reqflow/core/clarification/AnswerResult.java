package com.reqflow.core.clarification;

/**
 * Outcome of submitting an answer to a clarification question.
 */
public enum AnswerResult {
    /** The answer was accepted and resumes the waiting requirement. */
    OK,
    /** The question was already resolved (answered, defaulted on timeout or cancelled). */
    ALREADY_ANSWERED,
    /** No such run or question. */
    NOT_FOUND
}
