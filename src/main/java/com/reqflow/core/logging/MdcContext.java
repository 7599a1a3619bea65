package com.reqflow.core.logging;

import org.slf4j.MDC;

import java.util.Map;

/**
 * Utility for managing Reqflow-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String CORRELATION_ID = "correlationId";
    public static final String PHASE = "phase";
    public static final String ITEM_ID = "itemId";
    public static final String ATTEMPT = "attempt";

    private MdcContext() {}

    public static void setRun(String correlationId) {
        MDC.put(CORRELATION_ID, correlationId);
    }

    public static void setPhase(String correlationId, String phase) {
        MDC.put(CORRELATION_ID, correlationId);
        MDC.put(PHASE, phase);
    }

    public static void setItem(String itemId, int attempt) {
        MDC.put(ITEM_ID, itemId);
        MDC.put(ATTEMPT, String.valueOf(attempt));
    }

    public static void clearItem() {
        MDC.remove(ITEM_ID);
        MDC.remove(ATTEMPT);
    }

    /**
     * Wraps a task so it runs with the caller's MDC context on another thread.
     */
    public static Runnable propagate(Runnable task) {
        Map<String, String> parent = MDC.getCopyOfContextMap();
        return () -> {
            if (parent != null) {
                MDC.setContextMap(parent);
            }
            try {
                task.run();
            } finally {
                MDC.clear();
            }
        };
    }

    public static void clear() {
        MDC.remove(CORRELATION_ID);
        MDC.remove(PHASE);
        MDC.remove(ITEM_ID);
        MDC.remove(ATTEMPT);
    }
}
