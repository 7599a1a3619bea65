package com.reqflow.core.model;

import java.io.Serializable;

/**
 * Score for a single quality criterion (e.g. measurability, testability).
 */
public record CriterionResult(
    String criterion,
    double score,
    boolean passed,
    String feedback
) implements Serializable {}
