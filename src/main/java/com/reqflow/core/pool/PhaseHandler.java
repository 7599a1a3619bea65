package com.reqflow.core.pool;

/**
 * Work performed for a single work unit of a phase.
 * <p>
 * Implementations signal {@link com.reqflow.core.capability.TransientCallException} for failures
 * worth retrying and {@link com.reqflow.core.capability.FatalCallException} for failures that are
 * not. Long-running calls must observe {@link HandlerContext#token()} or thread interruption.
 */
@FunctionalInterface
public interface PhaseHandler<T, R> {

    R handle(T input, HandlerContext context) throws Exception;
}
