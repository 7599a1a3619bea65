package com.reqflow.core.capability;

/**
 * A capability call failed in a way retrying cannot fix (malformed input, unparseable output).
 */
public class FatalCallException extends RuntimeException {

    public FatalCallException(String message) {
        super(message);
    }

    public FatalCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
