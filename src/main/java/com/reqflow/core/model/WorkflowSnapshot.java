package com.reqflow.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of a workflow run.
 *
 * @param failureReason set once the run failed, null otherwise
 * @param phaseStats    statistics of every finished phase, in execution order
 */
public record WorkflowSnapshot(
    String correlationId,
    WorkflowPhase phase,
    FailureReason failureReason,
    String failureDetail,
    Instant startedAt,
    Instant endedAt,
    List<RequirementItem> items,
    Map<WorkflowPhase, PhaseStats> phaseStats
) implements Serializable {

    public WorkflowSnapshot {
        items = items != null ? List.copyOf(items) : List.of();
        phaseStats = phaseStats != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(phaseStats))
                : Map.of();
    }

    public boolean isTerminal() {
        return phase.isTerminal();
    }

    public long count(Verdict verdict) {
        return items.stream().filter(i -> i.verdict() == verdict).count();
    }
}
