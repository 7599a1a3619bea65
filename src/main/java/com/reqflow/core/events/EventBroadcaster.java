package com.reqflow.core.events;

import com.reqflow.core.config.ReqflowProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * In-memory fan-out of workflow events, one channel per correlation id.
 * <p>
 * Each channel assigns sequence numbers under its own lock and delivers to subscribers while
 * holding it, so every subscriber sees strictly increasing sequence numbers with no gaps even
 * when several workers publish at once. A bounded replay buffer lets late or reconnecting
 * subscribers catch up. Channels of finished runs are swept once the grace period has elapsed
 * and nobody is subscribed.
 */
@Service
public class EventBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(EventBroadcaster.class);

    private static final int DEFAULT_REPLAY_BUFFER_SIZE = 256;
    private static final Duration DEFAULT_GRACE_PERIOD = Duration.ofSeconds(60);

    private final ConcurrentHashMap<String, Channel> channels = new ConcurrentHashMap<>();

    private final int replayBufferSize;
    private final Duration gracePeriod;
    private final Duration sweepInterval;
    private final Clock clock;

    private ScheduledExecutorService sweeper;

    @Autowired
    public EventBroadcaster(ReqflowProperties properties) {
        this(properties.getEvents().getReplayBufferSize(),
                properties.getEvents().getGracePeriod(),
                properties.getEvents().getSweepInterval(),
                Clock.systemUTC());
    }

    public EventBroadcaster() {
        this(DEFAULT_REPLAY_BUFFER_SIZE, DEFAULT_GRACE_PERIOD, Duration.ZERO, Clock.systemUTC());
    }

    EventBroadcaster(int replayBufferSize, Duration gracePeriod, Duration sweepInterval, Clock clock) {
        if (replayBufferSize < 1) {
            throw new IllegalArgumentException("replayBufferSize must be at least 1");
        }
        this.replayBufferSize = replayBufferSize;
        this.gracePeriod = gracePeriod;
        this.sweepInterval = sweepInterval;
        this.clock = clock;
    }

    @PostConstruct
    void startSweeper() {
        if (sweepInterval.isZero() || sweepInterval.isNegative()) {
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "event-channel-sweeper");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = sweepInterval.toMillis();
        sweeper.scheduleAtFixedRate(this::sweepExpired, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Event channel sweeper started (interval={}ms, grace={}s)", intervalMs, gracePeriod.toSeconds());
    }

    @PreDestroy
    void stopSweeper() {
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
    }

    /**
     * Marks the channel for {@code correlationId} as belonging to an active run. Active channels
     * are never swept.
     */
    public void open(String correlationId) {
        withChannel(correlationId, channel -> {
            channel.active = true;
            channel.lastActivity = clock.instant();
        });
    }

    /**
     * Marks the run as finished; the channel becomes eligible for teardown after the grace period
     * once it has no subscribers.
     */
    public void markTerminal(String correlationId) {
        withChannel(correlationId, channel -> {
            channel.active = false;
            channel.lastActivity = clock.instant();
        });
    }

    /**
     * Publishes an event, assigning the next sequence number for the correlation id.
     *
     * @return the published event
     */
    public WorkflowEvent publish(String correlationId, EventKind kind, Map<String, Object> payload) {
        var holder = new WorkflowEvent[1];
        withChannel(correlationId, channel -> {
            Instant now = clock.instant();
            var event = new WorkflowEvent(correlationId, channel.nextSequence++, kind,
                    payload != null ? Map.copyOf(payload) : Map.of(), now);
            channel.replay.addLast(event);
            while (channel.replay.size() > replayBufferSize) {
                channel.replay.removeFirst();
            }
            channel.lastActivity = now;
            log.debug("Publishing {} #{} for {}", kind.wireName(), event.sequenceNumber(), correlationId);
            for (Consumer<WorkflowEvent> subscriber : channel.subscribers) {
                deliverSafely(subscriber, event);
            }
            holder[0] = event;
        });
        return holder[0];
    }

    /**
     * Subscribes to every buffered and future event of a correlation id.
     */
    public Subscription subscribe(String correlationId, Consumer<WorkflowEvent> consumer) {
        return subscribe(correlationId, 0L, consumer);
    }

    /**
     * Subscribes to a correlation id, replaying buffered events whose sequence number is greater
     * than {@code afterSequence} before any live event is delivered.
     *
     * @param afterSequence last sequence number the caller has already seen, 0 for none
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String correlationId, long afterSequence, Consumer<WorkflowEvent> consumer) {
        var holder = new Channel[1];
        withChannel(correlationId, channel -> {
            for (WorkflowEvent event : channel.replay) {
                if (event.sequenceNumber() > afterSequence) {
                    deliverSafely(consumer, event);
                }
            }
            channel.subscribers.add(consumer);
            holder[0] = channel;
        });
        log.debug("Subscribed to {} (after #{})", correlationId, afterSequence);
        Channel channel = holder[0];
        return () -> {
            synchronized (channel) {
                channel.subscribers.remove(consumer);
                channel.lastActivity = clock.instant();
            }
        };
    }

    /**
     * Opens a pull-style stream over the correlation id.
     */
    public EventStream stream(String correlationId) {
        var stream = new EventStream();
        stream.attach(subscribe(correlationId, stream::accept));
        return stream;
    }

    public int subscriberCount(String correlationId) {
        Channel channel = channels.get(correlationId);
        if (channel == null) {
            return 0;
        }
        synchronized (channel) {
            return channel.subscribers.size();
        }
    }

    public boolean hasChannel(String correlationId) {
        return channels.containsKey(correlationId);
    }

    /**
     * Tears down channels that are not active, have no subscribers and were last touched more
     * than the grace period ago.
     *
     * @return number of channels removed
     */
    public int sweepExpired() {
        Instant cutoff = clock.instant().minus(gracePeriod);
        int removed = 0;
        for (var entry : channels.entrySet()) {
            Channel channel = entry.getValue();
            synchronized (channel) {
                if (!channel.active && channel.subscribers.isEmpty()
                        && !channel.lastActivity.isAfter(cutoff)) {
                    channel.closed = true;
                    channels.remove(entry.getKey(), channel);
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.debug("Swept {} idle event channel(s)", removed);
        }
        return removed;
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void withChannel(String correlationId, Consumer<Channel> action) {
        while (true) {
            Channel channel = channels.computeIfAbsent(correlationId, id -> new Channel(clock.instant()));
            synchronized (channel) {
                if (!channel.closed) {
                    action.accept(channel);
                    return;
                }
            }
        }
    }

    private void deliverSafely(Consumer<WorkflowEvent> subscriber, WorkflowEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {} #{}: {}",
                    event.kind().wireName(), event.sequenceNumber(), e.getMessage(), e);
        }
    }

    /** Guarded by its own monitor. */
    private static final class Channel {
        long nextSequence = 1;
        final ArrayDeque<WorkflowEvent> replay = new ArrayDeque<>();
        final List<Consumer<WorkflowEvent>> subscribers = new CopyOnWriteArrayList<>();
        boolean active;
        boolean closed;
        Instant lastActivity;

        Channel(Instant createdAt) {
            this.lastActivity = createdAt;
        }
    }
}
