package com.reqflow.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for workflow execution.
 */
@Service
public class ReqflowMetrics {

    private final MeterRegistry registry;

    public ReqflowMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPhaseDuration(String phase, long ms) {
        Timer.builder("reqflow.phase.duration")
                .tag("phase", phase)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordItemDuration(String phase, long ms) {
        Timer.builder("reqflow.item.duration")
                .tag("phase", phase)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Counts finished work units.
     *
     * @param outcome "success" or the lower-case failure kind
     */
    public void recordItemOutcome(String phase, String outcome) {
        Counter.builder("reqflow.items.total")
                .tag("phase", phase)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordRetry(String phase) {
        Counter.builder("reqflow.item.retries")
                .description("Attempts repeated after a transient failure or timeout")
                .tag("phase", phase)
                .register(registry)
                .increment();
    }

    public void recordTimeout(String phase) {
        Counter.builder("reqflow.item.timeouts")
                .tag("phase", phase)
                .register(registry)
                .increment();
    }

    public void recordWorkflowResult(String status) {
        Counter.builder("reqflow.workflows.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordRewriteRounds(int rounds) {
        DistributionSummary.builder("reqflow.rewrite.rounds")
                .description("Rewrite rounds spent per requirement")
                .register(registry)
                .record(rounds);
    }

    /**
     * @param defaulted true when the answer came from the clarification timeout
     */
    public void recordClarification(boolean defaulted) {
        Counter.builder("reqflow.clarifications.total")
                .tag("source", defaulted ? "timeout" : "user")
                .register(registry)
                .increment();
    }
}
