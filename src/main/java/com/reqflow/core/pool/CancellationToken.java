package com.reqflow.core.pool;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation signal passed through every handler call.
 * <p>
 * A token is cancelled at most once; the first reason wins. Listeners registered before or
 * after cancellation run exactly once. Child tokens are cancelled with their parent but can
 * also be cancelled on their own (a per-attempt timeout cancels only the attempt).
 */
public class CancellationToken {

    private final AtomicReference<String> reason = new AtomicReference<>();
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private volatile Registration parentRegistration;

    public static CancellationToken none() {
        return new CancellationToken();
    }

    /**
     * Cancels the token.
     *
     * @return true if this call cancelled it, false if it was already cancelled
     */
    public boolean cancel(String why) {
        if (!reason.compareAndSet(null, why != null ? why : "cancelled")) {
            return false;
        }
        cancelled.countDown();
        for (Runnable listener : listeners) {
            listener.run();
        }
        return true;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    /** The cancellation reason, or null while the token is live. */
    public String reason() {
        return reason.get();
    }

    public void throwIfCancelled() {
        String why = reason.get();
        if (why != null) {
            throw new WorkflowCancelledException(why);
        }
    }

    /**
     * Registers a callback run on cancellation (immediately if already cancelled).
     *
     * @return a handle that removes the callback
     */
    public Registration onCancel(Runnable listener) {
        Runnable once = runOnce(listener);
        listeners.add(once);
        if (isCancelled()) {
            once.run();
        }
        return () -> listeners.remove(once);
    }

    /**
     * Creates a token that is cancelled when this one is. Call {@link #release()} on the child
     * once it is no longer needed so the parent drops its reference.
     */
    public CancellationToken child() {
        var child = new CancellationToken();
        child.parentRegistration = onCancel(() -> child.cancel(reason()));
        return child;
    }

    /**
     * Detaches a child token from its parent. No-op for root tokens.
     */
    public void release() {
        Registration registration = parentRegistration;
        if (registration != null) {
            registration.remove();
            parentRegistration = null;
        }
    }

    /**
     * Blocks until the token is cancelled or the timeout elapses.
     *
     * @return true if the token was cancelled
     */
    public boolean awaitCancellation(Duration timeout) throws InterruptedException {
        return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    private static Runnable runOnce(Runnable listener) {
        var ran = new AtomicBoolean();
        return () -> {
            if (ran.compareAndSet(false, true)) {
                listener.run();
            }
        };
    }

    @FunctionalInterface
    public interface Registration {
        void remove();
    }
}
