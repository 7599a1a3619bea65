package com.reqflow.core.config;

import com.reqflow.core.model.WorkflowPhase;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "reqflow")
public class ReqflowProperties {

    private Workflow workflow = new Workflow();
    private Events events = new Events();

    public Workflow getWorkflow() { return workflow; }
    public void setWorkflow(Workflow workflow) { this.workflow = workflow; }
    public Events getEvents() { return events; }
    public void setEvents(Events events) { this.events = events; }

    /**
     * Builds the default per-run configuration from the bound properties.
     */
    public WorkflowConfig toWorkflowConfig() {
        var concurrency = new EnumMap<WorkflowPhase, Integer>(WorkflowPhase.class);
        workflow.maxConcurrentPerPhase.forEach(
                (key, value) -> concurrency.put(WorkflowPhase.fromConfigKey(key), value));
        return new WorkflowConfig(
                concurrency,
                workflow.perItemTimeout,
                workflow.maxAttempts,
                workflow.clarificationTimeout,
                workflow.passThreshold,
                workflow.retryBackoff,
                workflow.rewriteMaxRounds,
                workflow.kgBatchSize,
                workflow.duplicateThreshold,
                workflow.searchTopK
        );
    }

    public static class Workflow {
        private Map<String, Integer> maxConcurrentPerPhase = defaultConcurrency();
        private Duration perItemTimeout = Duration.ofSeconds(60);
        private int maxAttempts = 3;
        private Duration clarificationTimeout = Duration.ofSeconds(300);
        private double passThreshold = 0.7;
        private Duration retryBackoff = Duration.ofMillis(500);
        private int rewriteMaxRounds = 3;
        private int kgBatchSize = 10;
        private double duplicateThreshold = 0.85;
        private int searchTopK = 5;
        private int archiveSize = 100;

        private static Map<String, Integer> defaultConcurrency() {
            var map = new LinkedHashMap<String, Integer>();
            map.put("mining", 10);
            map.put("kg-build", 4);
            map.put("validating", 5);
            map.put("rewriting", 3);
            map.put("qa-review", 5);
            map.put("clarification", 5);
            return map;
        }

        public Map<String, Integer> getMaxConcurrentPerPhase() { return maxConcurrentPerPhase; }
        public void setMaxConcurrentPerPhase(Map<String, Integer> maxConcurrentPerPhase) { this.maxConcurrentPerPhase = maxConcurrentPerPhase; }
        public Duration getPerItemTimeout() { return perItemTimeout; }
        public void setPerItemTimeout(Duration perItemTimeout) { this.perItemTimeout = perItemTimeout; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getClarificationTimeout() { return clarificationTimeout; }
        public void setClarificationTimeout(Duration clarificationTimeout) { this.clarificationTimeout = clarificationTimeout; }
        public double getPassThreshold() { return passThreshold; }
        public void setPassThreshold(double passThreshold) { this.passThreshold = passThreshold; }
        public Duration getRetryBackoff() { return retryBackoff; }
        public void setRetryBackoff(Duration retryBackoff) { this.retryBackoff = retryBackoff; }
        public int getRewriteMaxRounds() { return rewriteMaxRounds; }
        public void setRewriteMaxRounds(int rewriteMaxRounds) { this.rewriteMaxRounds = rewriteMaxRounds; }
        public int getKgBatchSize() { return kgBatchSize; }
        public void setKgBatchSize(int kgBatchSize) { this.kgBatchSize = kgBatchSize; }
        public double getDuplicateThreshold() { return duplicateThreshold; }
        public void setDuplicateThreshold(double duplicateThreshold) { this.duplicateThreshold = duplicateThreshold; }
        public int getSearchTopK() { return searchTopK; }
        public void setSearchTopK(int searchTopK) { this.searchTopK = searchTopK; }
        public int getArchiveSize() { return archiveSize; }
        public void setArchiveSize(int archiveSize) { this.archiveSize = archiveSize; }
    }

    public static class Events {
        private int replayBufferSize = 256;
        private Duration gracePeriod = Duration.ofSeconds(60);
        private Duration sweepInterval = Duration.ofSeconds(15);

        public int getReplayBufferSize() { return replayBufferSize; }
        public void setReplayBufferSize(int replayBufferSize) { this.replayBufferSize = replayBufferSize; }
        public Duration getGracePeriod() { return gracePeriod; }
        public void setGracePeriod(Duration gracePeriod) { this.gracePeriod = gracePeriod; }
        public Duration getSweepInterval() { return sweepInterval; }
        public void setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; }
    }
}
