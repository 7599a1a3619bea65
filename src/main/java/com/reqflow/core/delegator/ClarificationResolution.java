package com.reqflow.core.delegator;

import com.reqflow.core.model.ClarificationAnswer;
import com.reqflow.core.model.Verdict;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Answers collected for one requirement's questions.
 *
 * @param revisedText replacement text supplied as a free-text answer, or null
 */
public record ClarificationResolution(
    String itemId,
    List<ClarificationAnswer> answers,
    Verdict verdict,
    String revisedText
) implements HandlerResult {

    public ClarificationResolution {
        answers = List.copyOf(answers);
    }

    @Override
    public Double score() {
        return null;
    }

    @Override
    public String detail() {
        return answers.stream()
                .map(a -> a.questionId() + "=" + a.value() + (a.defaulted() ? " (timeout)" : ""))
                .collect(Collectors.joining(", "));
    }
}
