package com.reqflow.core.delegator;

import com.reqflow.core.model.CriterionResult;
import com.reqflow.core.model.Evaluation;
import com.reqflow.core.model.Verdict;

import java.util.stream.Collectors;

/**
 * Evaluation of one requirement, judged against the pass threshold.
 */
public record ValidationVerdict(Evaluation evaluation, double threshold) implements HandlerResult {

    @Override
    public Verdict verdict() {
        return evaluation.score() >= threshold ? Verdict.PASS : Verdict.FAIL;
    }

    @Override
    public Double score() {
        return evaluation.score();
    }

    @Override
    public String detail() {
        var failing = evaluation.failingCriteria();
        if (failing.isEmpty()) {
            return String.format("score %.2f", evaluation.score());
        }
        return String.format("score %.2f, failing: %s", evaluation.score(),
                failing.stream().map(CriterionResult::criterion).collect(Collectors.joining(", ")));
    }
}
