package com.reqflow.core.pool;

/**
 * Notified from the slot thread as soon as a work unit reaches its final result.
 */
@FunctionalInterface
public interface CompletionListener<R> {

    void onComplete(ItemResult<R> result);

    static <R> CompletionListener<R> none() {
        return result -> {};
    }
}
