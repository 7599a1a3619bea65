package com.reqflow.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A question published to a human when QA review leaves an issue unresolved.
 */
public record ClarificationQuestion(
    String questionId,
    String correlationId,
    String itemId,
    IssueKind kind,
    String prompt,
    List<String> options,
    String contextHint,
    QuestionPriority priority
) implements Serializable {

    public ClarificationQuestion {
        options = options != null ? List.copyOf(options) : List.of();
    }

    public boolean isOption(String value) {
        return value != null && options.stream().anyMatch(o -> o.equalsIgnoreCase(value.trim()));
    }
}
