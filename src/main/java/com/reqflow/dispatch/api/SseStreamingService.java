package com.reqflow.dispatch.api;

import com.reqflow.core.events.EventBroadcaster;
import com.reqflow.core.events.EventKind;
import com.reqflow.core.events.WorkflowEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link EventBroadcaster} subscriptions to {@link SseEmitter}s.
 * <p>
 * Each frame carries the event kind as its name and the sequence number as its id, so a
 * browser reconnecting with {@code Last-Event-ID} resumes right after the last event it saw.
 * The emitter completes after the {@code workflow_result} frame. Idle connections are kept
 * open with heartbeat comments, which EventSource clients ignore.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBroadcaster broadcaster;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBroadcaster broadcaster) {
        this(broadcaster, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBroadcaster broadcaster, long timeoutMs) {
        this.broadcaster = broadcaster;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
        log.info("SSE heartbeat scheduler started (interval={}s)", HEARTBEAT_INTERVAL_SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                log.debug("Heartbeat failed for {} (connection likely closed): {}",
                        registration.correlationId, e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for {} (emitter not active)", registration.correlationId);
            }
        }
    }

    /**
     * Creates an emitter streaming the workflow's events.
     *
     * @param afterSequence last sequence number the client already has, 0 for everything buffered
     */
    public SseEmitter createEmitter(String correlationId, long afterSequence) {
        SseEmitter emitter = new SseEmitter(timeoutMs);

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for {}: {}", correlationId, e.getMessage());
        }

        EventBroadcaster.Subscription subscription = broadcaster.subscribe(correlationId, afterSequence,
                event -> sendEvent(emitter, event));

        var registration = new EmitterRegistration(correlationId, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for {}", correlationId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for {}: {}", correlationId, ex.getMessage());
            cleanup(registration);
        });

        log.info("SSE emitter created for {} (after #{}, timeout={}ms)", correlationId, afterSequence, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendEvent(SseEmitter emitter, WorkflowEvent event) {
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("correlationId", event.correlationId());
            data.put("sequenceNumber", event.sequenceNumber());
            data.put("kind", event.kind().wireName());
            data.put("payload", event.payload());
            data.put("timestamp", event.timestamp().toString());

            emitter.send(SseEmitter.event()
                    .id(String.valueOf(event.sequenceNumber()))
                    .name(event.kind().wireName())
                    .data(data));
            if (event.kind() == EventKind.WORKFLOW_RESULT) {
                emitter.complete();
            }
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} #{} for {}: {}", event.kind().wireName(),
                    event.sequenceNumber(), event.correlationId(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
        log.debug("Cleaned up SSE registration for {}", registration.correlationId);
    }

    private record EmitterRegistration(
            String correlationId,
            SseEmitter emitter,
            EventBroadcaster.Subscription subscription
    ) {}
}
