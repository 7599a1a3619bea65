package com.reqflow.core.pool;

import com.reqflow.core.capability.FatalCallException;
import com.reqflow.core.capability.TransientCallException;
import com.reqflow.core.metrics.ReqflowMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link WorkerPool}.
 */
class WorkerPoolTest {

    private WorkerPool pool;

    @BeforeEach
    void setUp() {
        pool = new WorkerPool();
    }

    @AfterEach
    void tearDown() {
        pool.shutdown();
    }

    private static List<String> ids(int count) {
        var ids = new ArrayList<String>();
        for (int i = 1; i <= count; i++) {
            ids.add("item-" + i);
        }
        return ids;
    }

    private static TaskQueue<String> queue(int count) {
        return TaskQueue.of(ids(count), Function.identity());
    }

    private static PoolSettings settings(int maxConcurrent, Duration timeout, int maxAttempts) {
        return new PoolSettings("test", maxConcurrent, timeout, maxAttempts, Duration.ZERO);
    }

    @Nested
    @DisplayName("concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("never exceeds maxConcurrent and reaches it with slow handlers")
        void boundedConcurrency() {
            var inFlight = new AtomicInteger();
            var maxObserved = new AtomicInteger();
            PhaseHandler<String, String> handler = (item, ctx) -> {
                int now = inFlight.incrementAndGet();
                maxObserved.accumulateAndGet(now, Math::max);
                Thread.sleep(50);
                inFlight.decrementAndGet();
                return item;
            };

            var results = pool.run(queue(10), handler, settings(3, Duration.ofSeconds(5), 1),
                    CancellationToken.none());

            assertEquals(10, results.size());
            assertTrue(results.values().stream().allMatch(ItemResult::isSuccess));
            assertEquals(3, maxObserved.get());
        }

        @Test
        @DisplayName("starts units in queue order with a single slot")
        void fifoOrder() {
            var started = Collections.synchronizedList(new ArrayList<String>());
            PhaseHandler<String, String> handler = (item, ctx) -> {
                started.add(item);
                return item;
            };

            pool.run(queue(6), handler, settings(1, Duration.ofSeconds(5), 1), CancellationToken.none());

            assertEquals(ids(6), started);
        }

        @Test
        @DisplayName("returns results keyed in queue order")
        void resultsInQueueOrder() {
            PhaseHandler<String, String> handler = (item, ctx) -> {
                // later items finish first
                Thread.sleep(item.endsWith("1") ? 60 : 5);
                return item.toUpperCase();
            };

            var results = pool.run(queue(4), handler, settings(4, Duration.ofSeconds(5), 1),
                    CancellationToken.none());

            assertEquals(ids(4), new ArrayList<>(results.keySet()));
            assertEquals("ITEM-1", results.get("item-1").value());
        }

        @Test
        @DisplayName("empty queue returns no results")
        void emptyQueue() {
            var results = pool.run(TaskQueue.of(List.<String>of(), Function.identity()),
                    (item, ctx) -> item, settings(2, Duration.ofSeconds(1), 1), CancellationToken.none());
            assertTrue(results.isEmpty());
        }
    }

    @Nested
    @DisplayName("retries and failures")
    class RetryTests {

        @Test
        @DisplayName("transient failures are retried until success")
        void transientRetriedUntilSuccess() {
            var calls = new ConcurrentHashMap<String, AtomicInteger>();
            PhaseHandler<String, String> handler = (item, ctx) -> {
                int n = calls.computeIfAbsent(item, k -> new AtomicInteger()).incrementAndGet();
                if (item.equals("item-3") && n < 3) {
                    throw new TransientCallException("flaky " + n);
                }
                return item;
            };

            var results = pool.run(queue(5), handler, settings(2, Duration.ofSeconds(5), 3),
                    CancellationToken.none());

            assertTrue(results.get("item-3").isSuccess());
            assertEquals(3, results.get("item-3").attempts());
            for (String id : List.of("item-1", "item-2", "item-4", "item-5")) {
                assertEquals(1, results.get(id).attempts());
            }
        }

        @Test
        @DisplayName("transient failures on every attempt exhaust retries")
        void retriesExhausted() {
            var calls = new AtomicInteger();
            PhaseHandler<String, String> handler = (item, ctx) -> {
                calls.incrementAndGet();
                throw new TransientCallException("still down");
            };

            var results = pool.run(queue(1), handler, settings(1, Duration.ofSeconds(5), 3),
                    CancellationToken.none());

            var result = results.get("item-1");
            assertFalse(result.isSuccess());
            assertEquals(FailureKind.RETRIES_EXHAUSTED, result.failure());
            assertEquals(3, result.attempts());
            assertEquals("still down", result.error());
            assertEquals(3, calls.get());
        }

        @Test
        @DisplayName("fatal failures are not retried")
        void fatalNotRetried() {
            var calls = new AtomicInteger();
            PhaseHandler<String, String> handler = (item, ctx) -> {
                calls.incrementAndGet();
                throw new FatalCallException("bad input");
            };

            var result = pool.run(queue(1), handler, settings(1, Duration.ofSeconds(5), 3),
                    CancellationToken.none()).get("item-1");

            assertEquals(FailureKind.FATAL, result.failure());
            assertEquals(1, result.attempts());
            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("unclassified exceptions are fatal")
        void unclassifiedIsFatal() {
            PhaseHandler<String, String> handler = (item, ctx) -> {
                throw new IllegalStateException("boom");
            };

            var result = pool.run(queue(1), handler, settings(1, Duration.ofSeconds(5), 3),
                    CancellationToken.none()).get("item-1");

            assertEquals(FailureKind.FATAL, result.failure());
            assertEquals("boom", result.error());
        }

        @Test
        @DisplayName("a handler throwing an Error fails only its own unit and the run returns")
        void errorIsFatalAndIsolated() {
            var seen = new ConcurrentHashMap<String, Integer>();
            PhaseHandler<String, String> handler = (item, ctx) -> {
                if (item.equals("b")) {
                    throw new AssertionError("broken invariant");
                }
                return item.toUpperCase();
            };

            var results = assertTimeoutPreemptively(Duration.ofSeconds(5), () ->
                    pool.run(TaskQueue.of(List.of("a", "b", "c"), Function.identity()), handler,
                            settings(2, Duration.ofSeconds(2), 3), CancellationToken.none(),
                            result -> seen.merge(result.id(), 1, Integer::sum)));

            assertEquals(List.of("a", "b", "c"), new ArrayList<>(results.keySet()));
            assertEquals("A", results.get("a").value());
            assertEquals("C", results.get("c").value());
            assertEquals(FailureKind.FATAL, results.get("b").failure());
            assertEquals("broken invariant", results.get("b").error());
            assertEquals(1, results.get("b").attempts());
            assertEquals(Map.of("a", 1, "b", 1, "c", 1), seen);
        }

        @Test
        @DisplayName("a listener throwing an Error still leaves a result for its unit")
        void listenerErrorDoesNotHang() {
            var results = assertTimeoutPreemptively(Duration.ofSeconds(5), () ->
                    pool.run(queue(3), (item, ctx) -> item, settings(3, Duration.ofSeconds(2), 1),
                            CancellationToken.none(), result -> {
                                if (result.id().equals("item-2")) {
                                    throw new StackOverflowError();
                                }
                            }));

            assertEquals(3, results.size());
            assertTrue(results.get("item-1").isSuccess());
            assertEquals(FailureKind.FATAL, results.get("item-2").failure());
            assertEquals("StackOverflowError", results.get("item-2").error());
            assertTrue(results.get("item-3").isSuccess());
        }

        @Test
        @DisplayName("a timing-out item errors without affecting its siblings")
        void timeoutIsolated() {
            PhaseHandler<String, String> handler = (item, ctx) -> {
                if (item.equals("item-2")) {
                    Thread.sleep(5_000);
                }
                return item;
            };

            var results = pool.run(queue(4), handler, settings(4, Duration.ofMillis(100), 2),
                    CancellationToken.none());

            assertEquals(4, results.size());
            var slow = results.get("item-2");
            assertEquals(FailureKind.TIMEOUT, slow.failure());
            assertEquals(2, slow.attempts());
            for (String id : List.of("item-1", "item-3", "item-4")) {
                assertTrue(results.get(id).isSuccess(), id);
            }
        }

        @Test
        @DisplayName("the attempt token is cancelled on timeout")
        void attemptTokenCancelledOnTimeout() {
            var sawCancel = new AtomicInteger();
            PhaseHandler<String, String> handler = (item, ctx) -> {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    if (ctx.token().isCancelled()) {
                        sawCancel.incrementAndGet();
                    }
                    throw e;
                }
                return item;
            };

            var result = pool.run(queue(1), handler, settings(1, Duration.ofMillis(50), 1),
                    CancellationToken.none()).get("item-1");

            assertEquals(FailureKind.TIMEOUT, result.failure());
            assertEquals(1, sawCancel.get());
        }

        @Test
        @DisplayName("records retry and timeout metrics")
        void recordsMetrics() {
            var registry = new SimpleMeterRegistry();
            var metered = new WorkerPool(new ReqflowMetrics(registry));
            try {
                PhaseHandler<String, String> handler = (item, ctx) -> {
                    Thread.sleep(5_000);
                    return item;
                };
                metered.run(queue(1), handler, settings(1, Duration.ofMillis(50), 2), CancellationToken.none());

                assertEquals(2.0, registry.find("reqflow.item.timeouts").counter().count());
                assertEquals(1.0, registry.find("reqflow.item.retries").counter().count());
                assertEquals(1.0, registry.find("reqflow.items.total").tag("outcome", "timeout").counter().count());
            } finally {
                metered.shutdown();
            }
        }
    }

    @Nested
    @DisplayName("cancellation")
    class CancellationTests {

        @Test
        @DisplayName("cancelling the run stops in-flight and pending units")
        void cancelStopsEverything() throws Exception {
            var token = CancellationToken.none();
            var started = new CountDownLatch(2);
            PhaseHandler<String, String> handler = (item, ctx) -> {
                started.countDown();
                Thread.sleep(10_000);
                return item;
            };

            var scheduler = Executors.newSingleThreadScheduledExecutor();
            try {
                scheduler.execute(() -> {
                    try {
                        if (started.await(5, TimeUnit.SECONDS)) {
                            token.cancel("stop");
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });

                long begin = System.nanoTime();
                Map<String, ItemResult<String>> results = pool.run(queue(6), handler,
                        settings(2, Duration.ofSeconds(30), 3), token);
                long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin);

                assertEquals(6, results.size());
                assertTrue(results.values().stream().allMatch(r -> r.failure() == FailureKind.CANCELLED));
                assertTrue(elapsedMs < 5_000, "took " + elapsedMs + "ms");
            } finally {
                scheduler.shutdownNow();
            }
        }

        @Test
        @DisplayName("already-cancelled token yields cancelled results without calling the handler")
        void alreadyCancelled() {
            var token = CancellationToken.none();
            token.cancel("early");
            var calls = new AtomicInteger();

            var results = pool.run(queue(3), (item, ctx) -> {
                calls.incrementAndGet();
                return item;
            }, settings(2, Duration.ofSeconds(1), 1), token);

            assertEquals(0, calls.get());
            assertTrue(results.values().stream().allMatch(r -> r.failure() == FailureKind.CANCELLED));
            assertEquals("Cancelled: early", results.get("item-1").error());
        }
    }

    @Test
    @DisplayName("completion listener sees every result once")
    void listenerCalledPerUnit() {
        var seen = new ConcurrentHashMap<String, Integer>();
        pool.run(queue(5), (item, ctx) -> item, settings(3, Duration.ofSeconds(5), 1),
                CancellationToken.none(), result -> seen.merge(result.id(), 1, Integer::sum));

        assertEquals(5, seen.size());
        assertTrue(seen.values().stream().allMatch(n -> n == 1));
    }
}
