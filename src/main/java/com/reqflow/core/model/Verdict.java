package com.reqflow.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per-item verdict recorded by a phase.
 */
public enum Verdict {
    PASS,
    FAIL,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
