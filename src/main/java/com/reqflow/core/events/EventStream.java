package com.reqflow.core.events;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Pull-style view of a workflow stream. Receives the replay buffer on creation, then every
 * subsequent event, in sequence order. Close it to release the subscription.
 */
public class EventStream implements AutoCloseable {

    private final BlockingQueue<WorkflowEvent> queue = new LinkedBlockingQueue<>();
    private volatile EventBroadcaster.Subscription subscription;

    EventStream() {
    }

    void accept(WorkflowEvent event) {
        queue.add(event);
    }

    void attach(EventBroadcaster.Subscription subscription) {
        this.subscription = subscription;
    }

    /**
     * Waits up to {@code timeout} for the next event.
     *
     * @return the next event, or empty when none arrived in time
     */
    public Optional<WorkflowEvent> next(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    /**
     * Reads events until one of the given kind arrives or the timeout elapses.
     */
    public Optional<WorkflowEvent> nextOfKind(EventKind kind, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return Optional.empty();
            }
            WorkflowEvent event = queue.poll(remaining, TimeUnit.NANOSECONDS);
            if (event == null) {
                return Optional.empty();
            }
            if (event.kind() == kind) {
                return Optional.of(event);
            }
        }
    }

    @Override
    public void close() {
        var sub = subscription;
        if (sub != null) {
            sub.unsubscribe();
        }
    }
}
