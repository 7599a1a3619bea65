package com.reqflow.dispatch.api;

/**
 * Request body for answering a clarification question.
 */
public record ClarificationAnswerRequest(String answer) {}
