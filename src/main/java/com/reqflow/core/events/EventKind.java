package com.reqflow.core.events;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of events published on a workflow stream.
 */
public enum EventKind {
    /** Progress from a delegator or worker. */
    AGENT_MESSAGE("agent_message"),
    /** Phase transition. */
    WORKFLOW_STATUS("workflow_status"),
    /** Terminal payload (success or failure). */
    WORKFLOW_RESULT("workflow_result"),
    /** Clarification prompt awaiting an answer. */
    QUESTION("question");

    private final String wireName;

    EventKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
