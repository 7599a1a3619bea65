package com.reqflow.core.model;

/**
 * Kinds of issue QA review can raise for an item.
 */
public enum IssueKind {
    LOW_CONFIDENCE,
    DUPLICATE
}
