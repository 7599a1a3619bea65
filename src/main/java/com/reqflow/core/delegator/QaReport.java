package com.reqflow.core.delegator;

import com.reqflow.core.model.QaIssue;
import com.reqflow.core.model.Verdict;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Unresolved issues QA review found for one requirement. An empty report passes.
 */
public record QaReport(String itemId, Double score, List<QaIssue> issues) implements HandlerResult {

    public QaReport {
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    @Override
    public Verdict verdict() {
        return issues.isEmpty() ? Verdict.PASS : Verdict.FAIL;
    }

    @Override
    public String detail() {
        if (issues.isEmpty()) {
            return "no issues";
        }
        return issues.stream().map(QaIssue::detail).collect(Collectors.joining("; "));
    }
}
