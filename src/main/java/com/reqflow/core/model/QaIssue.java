package com.reqflow.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * An unresolved issue raised by QA review.
 *
 * @param itemId     the item the issue belongs to
 * @param kind       low confidence or duplicate
 * @param detail     description of the issue
 * @param relatedIds other items involved (duplicates), empty otherwise
 * @param criterion  weakest failing criterion for low-confidence issues (nullable)
 */
public record QaIssue(
    String itemId,
    IssueKind kind,
    String detail,
    List<String> relatedIds,
    String criterion
) implements Serializable {

    public QaIssue {
        relatedIds = relatedIds != null ? List.copyOf(relatedIds) : List.of();
    }
}
