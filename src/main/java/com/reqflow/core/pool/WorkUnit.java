package com.reqflow.core.pool;

/**
 * One entry of a {@link TaskQueue}.
 *
 * @param id      stable id used to key results
 * @param index   position in the queue (FIFO dispatch order)
 * @param payload the input handed to the phase handler
 */
public record WorkUnit<T>(String id, int index, T payload) {}
