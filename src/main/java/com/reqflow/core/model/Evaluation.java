package com.reqflow.core.model;

import java.io.Serializable;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Result of evaluating one requirement text.
 *
 * @param score        overall score in [0, 1]
 * @param verdict      verdict reported by the evaluator (informative; the workflow judges by threshold)
 * @param perCriterion per-criterion breakdown
 */
public record Evaluation(
    double score,
    Verdict verdict,
    List<CriterionResult> perCriterion
) implements Serializable {

    public Evaluation {
        perCriterion = perCriterion != null ? List.copyOf(perCriterion) : List.of();
    }

    /** Criteria that did not pass, lowest score first. */
    public List<CriterionResult> failingCriteria() {
        return perCriterion.stream()
                .filter(c -> !c.passed())
                .sorted(Comparator.comparingDouble(CriterionResult::score))
                .toList();
    }

    public Optional<CriterionResult> weakestCriterion() {
        return failingCriteria().stream().findFirst();
    }
}
