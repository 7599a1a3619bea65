package com.reqflow.core.capability;

/**
 * A capability call failed for a reason worth retrying (network, timeout, rate limit).
 */
public class TransientCallException extends RuntimeException {

    public TransientCallException(String message) {
        super(message);
    }

    public TransientCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
