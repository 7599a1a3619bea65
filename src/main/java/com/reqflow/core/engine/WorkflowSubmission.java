package com.reqflow.core.engine;

import com.reqflow.core.config.WorkflowConfig;
import com.reqflow.core.model.RequirementItem;
import com.reqflow.core.model.SourceDocument;

import java.util.List;

/**
 * A batch submitted for processing.
 *
 * @param correlationId caller-chosen id, or null to have one generated
 * @param items         pre-extracted requirements, carried through mining unchanged
 * @param documents     raw documents to mine
 * @param overrides     per-run configuration overrides, nullable
 */
public record WorkflowSubmission(
    String correlationId,
    List<RequirementItem> items,
    List<SourceDocument> documents,
    WorkflowConfig.Overrides overrides
) {

    public WorkflowSubmission {
        items = items != null ? List.copyOf(items) : List.of();
        documents = documents != null ? List.copyOf(documents) : List.of();
    }

    public static WorkflowSubmission ofItems(String correlationId, List<RequirementItem> items) {
        return new WorkflowSubmission(correlationId, items, List.of(), null);
    }
}
