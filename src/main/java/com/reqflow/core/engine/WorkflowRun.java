package com.reqflow.core.engine;

import com.reqflow.core.config.WorkflowConfig;
import com.reqflow.core.delegator.QaReport;
import com.reqflow.core.model.Evaluation;
import com.reqflow.core.model.FailureReason;
import com.reqflow.core.model.PhaseStats;
import com.reqflow.core.model.RequirementItem;
import com.reqflow.core.model.WorkflowPhase;
import com.reqflow.core.model.WorkflowSnapshot;
import com.reqflow.core.pool.CancellationToken;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Mutable state of one workflow run, owned by the orchestrator.
 * <p>
 * Phase changes happen under the run's monitor together with the publication of the
 * matching status event, so once the run is terminal no further transition can be observed.
 * Requirements live in {@link ItemSlot}s; a worker only touches the slot of the item it
 * processes, and each slot accepts one write per phase.
 */
public class WorkflowRun {

    private final String correlationId;
    private final WorkflowConfig config;
    private final CancellationToken token = new CancellationToken();
    private final Instant startedAt;

    private final LinkedHashMap<String, ItemSlot> slots = new LinkedHashMap<>();
    private final LinkedHashMap<WorkflowPhase, PhaseStats> phaseStats = new LinkedHashMap<>();
    private final Map<String, Evaluation> evaluations = new ConcurrentHashMap<>();
    private Map<String, QaReport> pendingReview = Map.of();

    private volatile WorkflowPhase phase = WorkflowPhase.PENDING;
    private FailureReason failureReason;
    private String failureDetail;
    private Instant endedAt;

    public WorkflowRun(String correlationId, WorkflowConfig config, Instant startedAt) {
        this.correlationId = correlationId;
        this.config = config;
        this.startedAt = startedAt;
    }

    public String correlationId() {
        return correlationId;
    }

    public WorkflowConfig config() {
        return config;
    }

    public CancellationToken token() {
        return token;
    }

    public WorkflowPhase phase() {
        return phase;
    }

    public synchronized FailureReason failureReason() {
        return failureReason;
    }

    /**
     * Moves the run to {@code next} and calls the listener while still holding the monitor.
     *
     * @return false if the run is already terminal; nothing changes then
     */
    public synchronized boolean enter(WorkflowPhase next, Instant at, TransitionListener listener) {
        if (phase.isTerminal()) {
            return false;
        }
        WorkflowPhase previous = phase;
        phase = next;
        if (next.isTerminal()) {
            endedAt = at;
        }
        listener.onTransition(previous, next);
        return true;
    }

    /**
     * Reports the current phase to the listener, under the monitor, unless the run is terminal.
     */
    public synchronized void announce(TransitionListener listener) {
        if (!phase.isTerminal()) {
            listener.onTransition(null, phase);
        }
    }

    /**
     * Fails the run unless it is already terminal.
     */
    public synchronized boolean fail(FailureReason reason, String detail, Instant at, TransitionListener listener) {
        if (phase.isTerminal()) {
            return false;
        }
        failureReason = reason;
        failureDetail = detail;
        return enter(WorkflowPhase.FAILED, at, listener);
    }

    /**
     * Adds a requirement unless one with the same id exists.
     */
    public synchronized boolean addItem(RequirementItem item) {
        if (slots.containsKey(item.id())) {
            return false;
        }
        slots.put(item.id(), new ItemSlot(item));
        return true;
    }

    public synchronized ItemSlot slot(String itemId) {
        ItemSlot slot = slots.get(itemId);
        if (slot == null) {
            throw new IllegalArgumentException("Unknown requirement " + itemId + " in run " + correlationId);
        }
        return slot;
    }

    public synchronized List<RequirementItem> items() {
        var items = new ArrayList<RequirementItem>(slots.size());
        for (ItemSlot slot : slots.values()) {
            items.add(slot.current());
        }
        return items;
    }

    public synchronized int itemCount() {
        return slots.size();
    }

    public synchronized void recordStats(WorkflowPhase phase, PhaseStats stats) {
        phaseStats.put(phase, stats);
    }

    public void recordEvaluation(String itemId, Evaluation evaluation) {
        evaluations.put(itemId, evaluation);
    }

    public Map<String, Evaluation> evaluations() {
        return Map.copyOf(evaluations);
    }

    /**
     * QA reports that flagged issues, to be resolved in the clarification phase.
     */
    public synchronized Map<String, QaReport> pendingReview() {
        return pendingReview;
    }

    public synchronized void setPendingReview(Map<String, QaReport> reports) {
        this.pendingReview = Collections.unmodifiableMap(new LinkedHashMap<>(reports));
    }

    public synchronized WorkflowSnapshot snapshot() {
        return new WorkflowSnapshot(correlationId, phase, failureReason, failureDetail,
                startedAt, endedAt, items(), phaseStats);
    }

    /**
     * Called with the run's monitor held when its phase changes.
     */
    @FunctionalInterface
    public interface TransitionListener {
        void onTransition(WorkflowPhase previous, WorkflowPhase next);
    }

    /**
     * The outcome slot of one requirement.
     */
    public static final class ItemSlot {
        private final Set<WorkflowPhase> written = EnumSet.noneOf(WorkflowPhase.class);
        private volatile RequirementItem current;

        ItemSlot(RequirementItem item) {
            this.current = item;
        }

        public RequirementItem current() {
            return current;
        }

        /**
         * Applies the single update a phase may make to this requirement.
         *
         * @throws IllegalStateException if the phase already wrote this slot
         */
        public synchronized RequirementItem record(WorkflowPhase phase, UnaryOperator<RequirementItem> update) {
            if (!written.add(phase)) {
                throw new IllegalStateException("Requirement " + current.id() + " already has an outcome for " + phase);
            }
            current = update.apply(current);
            return current;
        }
    }
}
