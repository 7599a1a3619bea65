package com.reqflow.core.llm;

/**
 * Thrown when the model returns null or blank content.
 */
public class LlmEmptyResponseException extends RuntimeException {

    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
