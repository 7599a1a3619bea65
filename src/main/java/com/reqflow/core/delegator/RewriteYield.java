package com.reqflow.core.delegator;

import com.reqflow.core.model.Evaluation;
import com.reqflow.core.model.Verdict;

/**
 * Best rewrite found for one failed requirement.
 *
 * @param originalText  text before rewriting
 * @param text          best text found (the original when no round improved it)
 * @param originalScore validation score before rewriting, null if never scored
 * @param bestScore     score of {@code text}
 * @param rounds        suggest / rewrite / evaluate rounds used
 * @param passed        whether {@code bestScore} reached the pass threshold
 * @param evaluation    evaluation of {@code text}, null when no round improved on the original
 */
public record RewriteYield(
    String originalText,
    String text,
    Double originalScore,
    double bestScore,
    int rounds,
    boolean passed,
    Evaluation evaluation
) implements HandlerResult {

    @Override
    public Verdict verdict() {
        return passed ? Verdict.PASS : Verdict.FAIL;
    }

    @Override
    public Double score() {
        return bestScore;
    }

    @Override
    public boolean improved() {
        return bestScore > (originalScore != null ? originalScore : 0.0);
    }

    @Override
    public String detail() {
        return String.format("score %.2f -> %.2f in %d round(s)",
                originalScore != null ? originalScore : 0.0, bestScore, rounds);
    }
}
