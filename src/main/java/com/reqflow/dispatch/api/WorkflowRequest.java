package com.reqflow.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.reqflow.core.config.WorkflowConfig;
import com.reqflow.core.engine.WorkflowSubmission;
import com.reqflow.core.model.RequirementItem;
import com.reqflow.core.model.SourceDocument;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/workflows.
 *
 * @param correlationId caller-chosen id; nullable, generated when absent
 * @param items         pre-extracted requirements; ids default to REQ-001, REQ-002, ...
 * @param documents     raw documents to mine; ids default to DOC-1, DOC-2, ...
 * @param config        per-run overrides; nullable
 */
public record WorkflowRequest(
    @JsonProperty("correlation_id") String correlationId,
    List<Item> items,
    List<Document> documents,
    Config config
) {

    public record Item(
        String id,
        String text,
        @JsonProperty("source_ref") String sourceRef
    ) {}

    public record Document(
        String id,
        String content,
        @JsonProperty("source_ref") String sourceRef
    ) {}

    /**
     * Durations accept ISO-8601 ({@code PT30S}) or a number of seconds.
     */
    public record Config(
        @JsonProperty("max_concurrent_per_phase") Map<String, Integer> maxConcurrentPerPhase,
        @JsonProperty("per_item_timeout") Duration perItemTimeout,
        @JsonProperty("max_attempts") Integer maxAttempts,
        @JsonProperty("clarification_timeout") Duration clarificationTimeout,
        @JsonProperty("pass_threshold") Double passThreshold
    ) {}

    public boolean isEmpty() {
        return (items == null || items.isEmpty()) && (documents == null || documents.isEmpty());
    }

    /**
     * @throws IllegalArgumentException if an item has no text or a document no content
     */
    public WorkflowSubmission toSubmission() {
        var requirementItems = new ArrayList<RequirementItem>();
        if (items != null) {
            for (Item item : items) {
                if (item.text() == null || item.text().isBlank()) {
                    throw new IllegalArgumentException("Requirement text is required");
                }
                String id = item.id() != null && !item.id().isBlank()
                        ? item.id()
                        : String.format("REQ-%03d", requirementItems.size() + 1);
                requirementItems.add(RequirementItem.of(id, item.text(), item.sourceRef()));
            }
        }
        var sourceDocuments = new ArrayList<SourceDocument>();
        if (documents != null) {
            for (Document document : documents) {
                if (document.content() == null || document.content().isBlank()) {
                    throw new IllegalArgumentException("Document content is required");
                }
                String id = document.id() != null && !document.id().isBlank()
                        ? document.id()
                        : "DOC-" + (sourceDocuments.size() + 1);
                sourceDocuments.add(new SourceDocument(id, document.content(), document.sourceRef()));
            }
        }
        WorkflowConfig.Overrides overrides = config == null ? null : new WorkflowConfig.Overrides(
                config.maxConcurrentPerPhase(), config.perItemTimeout(), config.maxAttempts(),
                config.clarificationTimeout(), config.passThreshold());
        return new WorkflowSubmission(correlationId, requirementItems, sourceDocuments, overrides);
    }
}
