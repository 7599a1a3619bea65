package com.reqflow.core.pool;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    @DisplayName("first cancel wins and keeps its reason")
    void firstReasonWins() {
        var token = CancellationToken.none();
        assertTrue(token.cancel("first"));
        assertFalse(token.cancel("second"));
        assertEquals("first", token.reason());
    }

    @Test
    @DisplayName("listeners run once, including those registered after cancellation")
    void listenersRunOnce() {
        var token = CancellationToken.none();
        var calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);
        token.cancel("stop");
        token.cancel("again");
        token.onCancel(calls::incrementAndGet);
        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("removed listeners are not called")
    void removedListener() {
        var token = CancellationToken.none();
        var calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet).remove();
        token.cancel("stop");
        assertEquals(0, calls.get());
    }

    @Test
    @DisplayName("child follows parent but not the other way round")
    void childSemantics() {
        var parent = CancellationToken.none();
        var child = parent.child();
        var sibling = parent.child();

        child.cancel("timeout");
        assertFalse(parent.isCancelled());
        assertFalse(sibling.isCancelled());

        parent.cancel("run cancelled");
        assertTrue(sibling.isCancelled());
        assertEquals("run cancelled", sibling.reason());
        assertEquals("timeout", child.reason());
    }

    @Test
    @DisplayName("released child is no longer cancelled by its parent")
    void releasedChild() {
        var parent = CancellationToken.none();
        var child = parent.child();
        child.release();
        parent.cancel("stop");
        assertFalse(child.isCancelled());
    }

    @Test
    @DisplayName("throwIfCancelled raises WorkflowCancelledException with the reason")
    void throwIfCancelled() {
        var token = CancellationToken.none();
        token.throwIfCancelled();
        token.cancel("user request");
        var e = assertThrows(WorkflowCancelledException.class, token::throwIfCancelled);
        assertEquals("user request", e.getMessage());
    }

    @Test
    @DisplayName("awaitCancellation times out on a live token and returns at once when cancelled")
    void awaitCancellation() throws InterruptedException {
        var token = CancellationToken.none();
        assertFalse(token.awaitCancellation(Duration.ofMillis(20)));
        token.cancel("x");
        assertTrue(token.awaitCancellation(Duration.ofSeconds(5)));
    }

    @Test
    @DisplayName("task queue rejects blank and duplicate ids")
    void taskQueueValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> TaskQueue.of(List.of("a", "a"), Function.identity()));
        assertThrows(IllegalArgumentException.class,
                () -> TaskQueue.of(List.of("a", " "), Function.identity()));

        var queue = TaskQueue.of(List.of("x", "y"), Function.identity());
        assertEquals(1, queue.units().get(1).index());
        assertEquals("y", queue.units().get(1).id());
    }

    @Test
    @DisplayName("pool settings validate their limits")
    void poolSettingsValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> new PoolSettings("p", 0, Duration.ofSeconds(1), 1, null));
        assertThrows(IllegalArgumentException.class,
                () -> new PoolSettings("p", 1, Duration.ZERO, 1, null));
        assertThrows(IllegalArgumentException.class,
                () -> new PoolSettings("p", 1, Duration.ofSeconds(1), 0, null));
        assertEquals(Duration.ZERO, new PoolSettings("p", 1, Duration.ofSeconds(1), 1, null).retryBackoff());
    }
}
