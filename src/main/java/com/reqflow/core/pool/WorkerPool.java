package com.reqflow.core.pool;

import com.reqflow.core.capability.TransientCallException;
import com.reqflow.core.logging.MdcContext;
import com.reqflow.core.metrics.ReqflowMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a {@link TaskQueue} through a {@link PhaseHandler} with bounded concurrency.
 * <p>
 * Each call gets its own fixed set of slot threads, so at most {@code maxConcurrent} handler
 * invocations are in flight and units start in queue order. Every attempt is guarded by a
 * timeout that cancels the attempt's token and interrupts the slot thread. Transient failures
 * and timeouts are retried with linear backoff; anything else fails the unit immediately.
 * One unit's failure never affects its siblings.
 */
@Component
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final ReqflowMetrics metrics;
    private final ScheduledExecutorService timeouts;

    @Autowired
    public WorkerPool(ReqflowMetrics metrics) {
        this.metrics = metrics;
        this.timeouts = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "pool-timeouts");
            t.setDaemon(true);
            return t;
        });
    }

    public WorkerPool() {
        this(null);
    }

    @PreDestroy
    public void shutdown() {
        timeouts.shutdownNow();
    }

    public <T, R> Map<String, ItemResult<R>> run(TaskQueue<T> queue, PhaseHandler<T, R> handler,
                                                 PoolSettings settings, CancellationToken token) {
        return run(queue, handler, settings, token, CompletionListener.none());
    }

    /**
     * Processes every unit of the queue and blocks until all of them have a result.
     *
     * @return one result per unit, keyed by id, in queue order
     */
    public <T, R> Map<String, ItemResult<R>> run(TaskQueue<T> queue, PhaseHandler<T, R> handler,
                                                 PoolSettings settings, CancellationToken token,
                                                 CompletionListener<R> listener) {
        var results = new LinkedHashMap<String, ItemResult<R>>();
        if (queue.isEmpty()) {
            return results;
        }

        int slots = Math.min(settings.maxConcurrent(), queue.size());
        var counter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(slots, r -> {
            Thread t = new Thread(r, "pool-" + settings.name() + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Pool {} processing {} unit(s) on {} slot(s)", settings.name(), queue.size(), slots);

        List<CompletableFuture<ItemResult<R>>> futures = new ArrayList<>(queue.size());
        try {
            for (WorkUnit<T> unit : queue.units()) {
                var future = new CompletableFuture<ItemResult<R>>();
                futures.add(future);
                executor.execute(MdcContext.propagate(() -> {
                    try {
                        future.complete(process(unit, handler, settings, token, listener));
                    } catch (Throwable t) {
                        future.completeExceptionally(t);
                    }
                }));
            }

            for (int i = 0; i < futures.size(); i++) {
                String id = queue.units().get(i).id();
                try {
                    results.put(id, futures.get(i).get());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    results.put(id, ItemResult.failure(id, FailureKind.CANCELLED,
                            "Interrupted while waiting for result", 0, 0));
                } catch (ExecutionException e) {
                    log.error("Pool {} lost unit {}: {}", settings.name(), id, e.getCause().toString(), e.getCause());
                    results.put(id, ItemResult.failure(id, FailureKind.FATAL, describe(e.getCause()), 0, 0));
                }
            }
        } finally {
            executor.shutdownNow();
        }
        return results;
    }

    private <T, R> ItemResult<R> process(WorkUnit<T> unit, PhaseHandler<T, R> handler,
                                         PoolSettings settings, CancellationToken token,
                                         CompletionListener<R> listener) {
        long start = System.nanoTime();
        ItemResult<R> result = attemptAll(unit, handler, settings, token, start);
        MdcContext.clearItem();

        if (metrics != null) {
            metrics.recordItemDuration(settings.name(), result.elapsedMs());
            metrics.recordItemOutcome(settings.name(),
                    result.isSuccess() ? "success" : result.failure().name().toLowerCase());
        }
        try {
            listener.onComplete(result);
        } catch (RuntimeException e) {
            log.warn("Completion listener failed for {}: {}", unit.id(), e.getMessage(), e);
        }
        return result;
    }

    private <T, R> ItemResult<R> attemptAll(WorkUnit<T> unit, PhaseHandler<T, R> handler,
                                            PoolSettings settings, CancellationToken token, long start) {
        FailureKind lastKind = FailureKind.RETRIES_EXHAUSTED;
        String lastError = null;

        for (int attempt = 1; attempt <= settings.maxAttempts(); attempt++) {
            if (token.isCancelled()) {
                return cancelled(unit, token, attempt - 1, start);
            }
            if (attempt > 1 && !settings.retryBackoff().isZero()) {
                Duration delay = settings.retryBackoff().multipliedBy(attempt - 1);
                try {
                    if (token.awaitCancellation(delay)) {
                        return cancelled(unit, token, attempt - 1, start);
                    }
                } catch (InterruptedException e) {
                    return cancelled(unit, token, attempt - 1, start);
                }
            }
            MdcContext.setItem(unit.id(), attempt);

            var current = new Attempt(Thread.currentThread(), token.child());
            CancellationToken.Registration interruptOnCancel = current.token.onCancel(current::interruptIfRunning);
            ScheduledFuture<?> timer = timeouts.schedule(current::timeOut,
                    settings.perItemTimeout().toMillis(), TimeUnit.MILLISECONDS);

            R value = null;
            Throwable error = null;
            boolean returned = false;
            try {
                value = handler.handle(unit.payload(), new HandlerContext(settings.name(), unit.id(), attempt, current.token));
                returned = true;
            } catch (Exception | Error e) {
                error = e;
            } finally {
                current.finish();
                timer.cancel(false);
                interruptOnCancel.remove();
                current.token.release();
                Thread.interrupted();
            }

            if (current.timedOut()) {
                lastKind = FailureKind.TIMEOUT;
                lastError = "Attempt timed out after " + settings.perItemTimeout().toMillis() + "ms";
                log.warn("{} attempt {}/{} for {} timed out", settings.name(), attempt, settings.maxAttempts(), unit.id());
                if (metrics != null) {
                    metrics.recordTimeout(settings.name());
                }
            } else if (token.isCancelled()) {
                return cancelled(unit, token, attempt, start);
            } else if (returned) {
                return ItemResult.success(unit.id(), value, attempt, elapsedMs(start));
            } else if (error instanceof TransientCallException) {
                lastKind = FailureKind.RETRIES_EXHAUSTED;
                lastError = error.getMessage();
                log.warn("{} attempt {}/{} for {} failed transiently: {}",
                        settings.name(), attempt, settings.maxAttempts(), unit.id(), error.getMessage());
            } else if (error instanceof InterruptedException) {
                return ItemResult.failure(unit.id(), FailureKind.CANCELLED, "Interrupted", attempt, elapsedMs(start));
            } else {
                log.error("{} attempt {} for {} failed: {}", settings.name(), attempt, unit.id(),
                        error.getMessage(), error);
                return ItemResult.failure(unit.id(), FailureKind.FATAL, describe(error), attempt, elapsedMs(start));
            }

            if (attempt < settings.maxAttempts() && metrics != null) {
                metrics.recordRetry(settings.name());
            }
        }
        return ItemResult.failure(unit.id(), lastKind, lastError, settings.maxAttempts(), elapsedMs(start));
    }

    private static <R> ItemResult<R> cancelled(WorkUnit<?> unit, CancellationToken token, int attempts, long start) {
        return ItemResult.failure(unit.id(), FailureKind.CANCELLED,
                "Cancelled: " + token.reason(), attempts, elapsedMs(start));
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static long elapsedMs(long start) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    }

    /** One handler invocation; its monitor orders timeout against completion. */
    private static final class Attempt {
        private final Thread worker;
        private final CancellationToken token;
        private boolean done;
        private boolean timedOut;

        Attempt(Thread worker, CancellationToken token) {
            this.worker = worker;
            this.token = token;
        }

        synchronized void timeOut() {
            if (!done) {
                timedOut = true;
                token.cancel("attempt timed out");
            }
        }

        synchronized void interruptIfRunning() {
            if (!done) {
                worker.interrupt();
            }
        }

        synchronized void finish() {
            done = true;
        }

        synchronized boolean timedOut() {
            return timedOut;
        }
    }
}
