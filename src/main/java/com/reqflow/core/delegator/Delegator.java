package com.reqflow.core.delegator;

import com.reqflow.core.events.EventBroadcaster;
import com.reqflow.core.events.EventKind;
import com.reqflow.core.metrics.ReqflowMetrics;
import com.reqflow.core.model.PhaseOutcome;
import com.reqflow.core.model.PhaseResult;
import com.reqflow.core.model.Verdict;
import com.reqflow.core.model.WorkflowPhase;
import com.reqflow.core.pool.CancellationToken;
import com.reqflow.core.pool.ItemResult;
import com.reqflow.core.pool.PhaseHandler;
import com.reqflow.core.pool.PoolSettings;
import com.reqflow.core.pool.TaskQueue;
import com.reqflow.core.pool.WorkUnit;
import com.reqflow.core.pool.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Runs one phase: builds the task queue, fans it into the {@link WorkerPool}, aggregates
 * outcomes and publishes an {@code agent_message} after every unit completes.
 *
 * @param <T> work unit payload
 * @param <R> handler result
 */
public class Delegator<T, R extends HandlerResult> {

    private static final Logger log = LoggerFactory.getLogger(Delegator.class);

    private final WorkflowPhase phase;
    private final PhaseHandler<T, R> handler;
    private final Function<T, String> idOf;
    private final WorkerPool pool;
    private final EventBroadcaster broadcaster;
    private final ReqflowMetrics metrics;

    public Delegator(WorkflowPhase phase, PhaseHandler<T, R> handler, Function<T, String> idOf,
                     WorkerPool pool, EventBroadcaster broadcaster, ReqflowMetrics metrics) {
        this.phase = phase;
        this.handler = handler;
        this.idOf = idOf;
        this.pool = pool;
        this.broadcaster = broadcaster;
        this.metrics = metrics;
    }

    public WorkflowPhase phase() {
        return phase;
    }

    public PhaseResult<R> runPhase(String correlationId, List<T> inputs, PoolSettings settings,
                                   CancellationToken token) {
        return runPhase(correlationId, inputs, settings, token, OutcomeListener.none());
    }

    /**
     * Runs every input through the phase handler and returns the aggregated result. Blocks
     * until each unit has an outcome; cancelled units come back as errors.
     *
     * @param listener called on the worker thread as each unit's outcome is recorded
     */
    public PhaseResult<R> runPhase(String correlationId, List<T> inputs, PoolSettings settings,
                                   CancellationToken token, OutcomeListener<R> listener) {
        TaskQueue<T> queue = TaskQueue.of(inputs, idOf);
        var aggregator = new ResultAggregator<R>(phase,
                queue.units().stream().map(WorkUnit::id).toList());

        log.info("Phase {} starting with {} unit(s), maxConcurrent={}",
                phase, queue.size(), settings.maxConcurrent());
        long start = System.currentTimeMillis();

        Map<String, ItemResult<R>> results = pool.run(queue, handler, settings, token,
                result -> record(correlationId, aggregator::accept, listener, result));
        // The pool reports units it gave up waiting on without calling the listener.
        for (ItemResult<R> result : results.values()) {
            if (!aggregator.isRecorded(result.id())) {
                log.warn("Phase {} unit {} ended without a completion callback: {}",
                        phase, result.id(), result.error());
                record(correlationId, aggregator::acceptIfAbsent, listener, result);
            }
        }

        PhaseResult<R> phaseResult = aggregator.result();
        long elapsedMs = System.currentTimeMillis() - start;
        if (metrics != null) {
            metrics.recordPhaseDuration(phase.configKey(), elapsedMs);
        }
        var stats = phaseResult.stats();
        log.info("Phase {} finished in {}ms: total={} passed={} failed={} errored={} avgScore={}",
                phase, elapsedMs, stats.total(), stats.passed(), stats.failed(), stats.errored(),
                String.format("%.3f", stats.avgScore()));
        return phaseResult;
    }

    private void record(String correlationId, Recorder<R> recorder, OutcomeListener<R> listener,
                        ItemResult<R> result) {
        PhaseOutcome outcome = toOutcome(result);
        R payload = result.isSuccess() ? result.value() : null;
        var progress = recorder.record(result.id(), outcome, payload);
        if (progress == null) {
            return;
        }
        try {
            listener.onOutcome(result.id(), outcome, payload);
        } finally {
            publishProgress(correlationId, result.id(), outcome, progress);
        }
    }

    private PhaseOutcome toOutcome(ItemResult<R> result) {
        if (!result.isSuccess()) {
            return new PhaseOutcome(phase, null, Verdict.ERROR,
                    result.failure() + ": " + result.error(), result.attempts());
        }
        R value = result.value();
        if (value == null || value.verdict() == null) {
            return new PhaseOutcome(phase, null, Verdict.ERROR, "Handler returned no verdict", result.attempts());
        }
        return new PhaseOutcome(phase, value.score(), value.verdict(), value.detail(), result.attempts());
    }

    @FunctionalInterface
    private interface Recorder<R extends HandlerResult> {
        ResultAggregator.Progress record(String unitId, PhaseOutcome outcome, R payload);
    }

    private void publishProgress(String correlationId, String unitId, PhaseOutcome outcome,
                                 ResultAggregator.Progress progress) {
        var payload = new HashMap<String, Object>();
        payload.put("phase", phase.configKey());
        payload.put("itemId", unitId);
        payload.put("verdict", outcome.verdict().wireName());
        payload.put("attempts", outcome.attempts());
        if (outcome.score() != null) {
            payload.put("score", outcome.score());
        }
        if (outcome.detail() != null) {
            payload.put("detail", outcome.detail());
        }
        payload.put("completed", progress.completed());
        payload.put("total", progress.total());
        payload.put("passed", progress.passed());
        payload.put("failed", progress.failed());
        payload.put("errored", progress.errored());
        broadcaster.publish(correlationId, EventKind.AGENT_MESSAGE, Map.copyOf(payload));
    }
}
