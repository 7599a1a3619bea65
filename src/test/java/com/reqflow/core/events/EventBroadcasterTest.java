package com.reqflow.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBroadcaster}.
 */
class EventBroadcasterTest {

    private EventBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        broadcaster = new EventBroadcaster();
    }

    private static List<Long> sequences(List<WorkflowEvent> events) {
        return events.stream().map(WorkflowEvent::sequenceNumber).toList();
    }

    /** Clock whose instant can be moved by tests. */
    private static final class MutableClock extends Clock {
        private volatile Instant now = Instant.parse("2026-01-01T00:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(java.time.ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    @Nested
    @DisplayName("publish")
    class PublishTests {

        @Test
        @DisplayName("assigns sequence numbers from 1 per correlation id")
        void sequencePerChannel() {
            var a1 = broadcaster.publish("A", EventKind.AGENT_MESSAGE, Map.of());
            var b1 = broadcaster.publish("B", EventKind.AGENT_MESSAGE, Map.of());
            var a2 = broadcaster.publish("A", EventKind.WORKFLOW_STATUS, Map.of("phase", "mining"));

            assertEquals(1, a1.sequenceNumber());
            assertEquals(1, b1.sequenceNumber());
            assertEquals(2, a2.sequenceNumber());
            assertEquals("mining", a2.payload().get("phase"));
        }

        @Test
        @DisplayName("concurrent publishers produce strictly increasing sequences without gaps")
        void concurrentPublishers() throws Exception {
            var received = new CopyOnWriteArrayList<WorkflowEvent>();
            broadcaster.subscribe("RF-1", received::add);

            int threads = 8;
            int perThread = 200;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            var start = new CountDownLatch(1);
            try {
                for (int t = 0; t < threads; t++) {
                    executor.execute(() -> {
                        try {
                            start.await();
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            return;
                        }
                        for (int i = 0; i < perThread; i++) {
                            broadcaster.publish("RF-1", EventKind.AGENT_MESSAGE, Map.of("i", i));
                        }
                    });
                }
                start.countDown();
                executor.shutdown();
                assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
            } finally {
                executor.shutdownNow();
            }

            assertEquals(threads * perThread, received.size());
            for (int i = 0; i < received.size(); i++) {
                assertEquals(i + 1, received.get(i).sequenceNumber());
            }
        }

        @Test
        @DisplayName("a failing subscriber does not affect others")
        void failingSubscriberIsolated() {
            var received = new ArrayList<WorkflowEvent>();
            broadcaster.subscribe("RF-1", e -> {
                throw new RuntimeException("subscriber error");
            });
            broadcaster.subscribe("RF-1", received::add);

            broadcaster.publish("RF-1", EventKind.AGENT_MESSAGE, Map.of());

            assertEquals(1, received.size());
        }
    }

    @Nested
    @DisplayName("subscribe")
    class SubscribeTests {

        @Test
        @DisplayName("late subscribers get the replay buffer, then live events")
        void replayThenLive() {
            broadcaster.publish("RF-1", EventKind.WORKFLOW_STATUS, Map.of());
            broadcaster.publish("RF-1", EventKind.AGENT_MESSAGE, Map.of());

            var received = new ArrayList<WorkflowEvent>();
            broadcaster.subscribe("RF-1", received::add);
            broadcaster.publish("RF-1", EventKind.WORKFLOW_RESULT, Map.of());

            assertEquals(List.of(1L, 2L, 3L), sequences(received));
        }

        @Test
        @DisplayName("resuming after a sequence number skips what the caller has seen")
        void resume() {
            for (int i = 0; i < 5; i++) {
                broadcaster.publish("RF-1", EventKind.AGENT_MESSAGE, Map.of());
            }

            var received = new ArrayList<WorkflowEvent>();
            broadcaster.subscribe("RF-1", 3, received::add);

            assertEquals(List.of(4L, 5L), sequences(received));
        }

        @Test
        @DisplayName("replay buffer keeps only the most recent K events")
        void boundedReplay() {
            var small = new EventBroadcaster(3, Duration.ofSeconds(60), Duration.ZERO, Clock.systemUTC());
            for (int i = 0; i < 5; i++) {
                small.publish("RF-1", EventKind.AGENT_MESSAGE, Map.of());
            }

            var received = new ArrayList<WorkflowEvent>();
            small.subscribe("RF-1", received::add);

            assertEquals(List.of(3L, 4L, 5L), sequences(received));
        }

        @Test
        @DisplayName("unsubscribed consumers receive nothing further")
        void unsubscribe() {
            var received = new ArrayList<WorkflowEvent>();
            var subscription = broadcaster.subscribe("RF-1", received::add);
            broadcaster.publish("RF-1", EventKind.AGENT_MESSAGE, Map.of());
            subscription.unsubscribe();
            broadcaster.publish("RF-1", EventKind.AGENT_MESSAGE, Map.of());

            assertEquals(1, received.size());
            assertEquals(0, broadcaster.subscriberCount("RF-1"));
        }

        @Test
        @DisplayName("event stream delivers in order and filters by kind")
        void eventStream() throws InterruptedException {
            try (EventStream stream = broadcaster.stream("RF-1")) {
                broadcaster.publish("RF-1", EventKind.AGENT_MESSAGE, Map.of());
                broadcaster.publish("RF-1", EventKind.QUESTION, Map.of("questionId", "Q-1"));

                var question = stream.nextOfKind(EventKind.QUESTION, Duration.ofSeconds(1));
                assertTrue(question.isPresent());
                assertEquals(2, question.get().sequenceNumber());
                assertTrue(stream.next(Duration.ofMillis(20)).isEmpty());
            }
            assertEquals(0, broadcaster.subscriberCount("RF-1"));
        }
    }

    @Nested
    @DisplayName("sweepExpired")
    class SweepTests {

        @Test
        @DisplayName("removes terminal, unsubscribed channels after the grace period only")
        void sweepsAfterGrace() {
            var clock = new MutableClock();
            var swept = new EventBroadcaster(16, Duration.ofSeconds(60), Duration.ZERO, clock);
            swept.open("RF-1");
            swept.publish("RF-1", EventKind.WORKFLOW_RESULT, Map.of());
            swept.markTerminal("RF-1");

            clock.advance(Duration.ofSeconds(30));
            assertEquals(0, swept.sweepExpired());
            assertTrue(swept.hasChannel("RF-1"));

            clock.advance(Duration.ofSeconds(31));
            assertEquals(1, swept.sweepExpired());
            assertFalse(swept.hasChannel("RF-1"));
        }

        @Test
        @DisplayName("active channels and channels with subscribers are kept")
        void keepsActiveOrSubscribed() {
            var clock = new MutableClock();
            var swept = new EventBroadcaster(16, Duration.ofSeconds(1), Duration.ZERO, clock);
            swept.open("ACTIVE");
            swept.subscribe("WATCHED", e -> { });

            clock.advance(Duration.ofMinutes(5));

            assertEquals(0, swept.sweepExpired());
            assertTrue(swept.hasChannel("ACTIVE"));
            assertTrue(swept.hasChannel("WATCHED"));
        }
    }
}
