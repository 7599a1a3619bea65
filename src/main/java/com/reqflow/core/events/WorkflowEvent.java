package com.reqflow.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a workflow run, used for SSE streaming and CLI watch mode.
 *
 * @param correlationId  the run this event belongs to
 * @param sequenceNumber position in the run's stream; strictly increasing, no gaps, starting at 1
 * @param kind           event kind
 * @param payload        arbitrary key-value data associated with the event
 * @param timestamp      when the event was published
 */
public record WorkflowEvent(
    String correlationId,
    long sequenceNumber,
    EventKind kind,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
