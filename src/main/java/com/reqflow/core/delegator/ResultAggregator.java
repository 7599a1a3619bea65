package com.reqflow.core.delegator;

import com.reqflow.core.model.PhaseOutcome;
import com.reqflow.core.model.PhaseResult;
import com.reqflow.core.model.PhaseStats;
import com.reqflow.core.model.Verdict;
import com.reqflow.core.model.WorkflowPhase;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Collects per-unit outcomes of one phase, keyed by unit id, in whatever order workers finish.
 * <p>
 * Running counters are kept for progress events. The final {@link PhaseResult} is computed
 * in a single pass over the units in queue order, so its statistics do not depend on
 * completion order.
 */
public class ResultAggregator<R extends HandlerResult> {

    private final WorkflowPhase phase;
    private final List<String> unitIds;
    private final Set<String> expected;
    private final ConcurrentHashMap<String, PhaseOutcome> outcomes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, R> payloads = new ConcurrentHashMap<>();

    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicInteger passed = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger errored = new AtomicInteger();

    public ResultAggregator(WorkflowPhase phase, List<String> unitIds) {
        this.phase = phase;
        this.unitIds = List.copyOf(unitIds);
        this.expected = Set.copyOf(unitIds);
    }

    /**
     * Records the outcome of one unit.
     *
     * @return running counters including this outcome
     * @throws IllegalStateException if the unit is unknown or already has an outcome
     */
    public Progress accept(String unitId, PhaseOutcome outcome, R payload) {
        Progress progress = acceptIfAbsent(unitId, outcome, payload);
        if (progress == null) {
            throw new IllegalStateException("Outcome for " + unitId + " already recorded in phase " + phase);
        }
        return progress;
    }

    /**
     * Records the outcome of one unit unless it already has one.
     *
     * @return running counters including this outcome, or {@code null} if an outcome was already recorded
     * @throws IllegalStateException if the unit is unknown
     */
    public Progress acceptIfAbsent(String unitId, PhaseOutcome outcome, R payload) {
        if (!expected.contains(unitId)) {
            throw new IllegalStateException("Unknown work unit " + unitId + " in phase " + phase);
        }
        if (outcomes.putIfAbsent(unitId, outcome) != null) {
            return null;
        }
        if (payload != null) {
            payloads.put(unitId, payload);
        }
        switch (outcome.verdict()) {
            case PASS -> passed.incrementAndGet();
            case FAIL -> failed.incrementAndGet();
            case ERROR -> errored.incrementAndGet();
        }
        return new Progress(completed.incrementAndGet(), unitIds.size(),
                passed.get(), failed.get(), errored.get());
    }

    public boolean isRecorded(String unitId) {
        return outcomes.containsKey(unitId);
    }

    /**
     * Builds the immutable phase result.
     *
     * @throws IllegalStateException if any unit is still missing an outcome
     */
    public PhaseResult<R> result() {
        var orderedOutcomes = new LinkedHashMap<String, PhaseOutcome>();
        var orderedPayloads = new LinkedHashMap<String, R>();
        int pass = 0;
        int fail = 0;
        int error = 0;
        int improved = 0;
        int scored = 0;
        double mean = 0.0;

        for (String id : unitIds) {
            PhaseOutcome outcome = outcomes.get(id);
            if (outcome == null) {
                throw new IllegalStateException("No outcome for " + id + " in phase " + phase);
            }
            orderedOutcomes.put(id, outcome);
            R payload = payloads.get(id);
            if (payload != null) {
                orderedPayloads.put(id, payload);
                if (payload.improved()) {
                    improved++;
                }
            }
            if (outcome.verdict() == Verdict.ERROR) {
                error++;
                continue;
            }
            if (outcome.verdict() == Verdict.PASS) {
                pass++;
            } else {
                fail++;
            }
            if (outcome.score() != null) {
                scored++;
                mean += (outcome.score() - mean) / scored;
            }
        }
        var stats = new PhaseStats(unitIds.size(), pass, fail, error, improved, mean);
        return new PhaseResult<>(phase, orderedOutcomes, orderedPayloads, stats);
    }

    /**
     * Running counters after an outcome was accepted.
     */
    public record Progress(int completed, int total, int passed, int failed, int errored) {}
}
