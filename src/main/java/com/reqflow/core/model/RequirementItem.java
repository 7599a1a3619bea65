package com.reqflow.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * A single requirement flowing through the workflow.
 * <p>
 * Instances are immutable; each phase produces a new copy through the {@code with*} methods.
 *
 * @param id           stable identifier, caller- or mining-assigned
 * @param text         current requirement text (rewrites and clarifications replace it)
 * @param sourceRef    where the requirement came from (document id, chunk, caller reference)
 * @param currentScore latest validation score (nullable until validated)
 * @param verdict      latest verdict (nullable until judged)
 * @param history      outcomes appended in phase order
 */
public record RequirementItem(
    String id,
    String text,
    String sourceRef,
    Double currentScore,
    Verdict verdict,
    List<PhaseOutcome> history
) implements Serializable {

    public RequirementItem {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Requirement id is required");
        }
        text = text != null ? text : "";
        history = history != null ? List.copyOf(history) : List.of();
    }

    public static RequirementItem of(String id, String text, String sourceRef) {
        return new RequirementItem(id, text, sourceRef, null, null, List.of());
    }

    public RequirementItem withOutcome(PhaseOutcome outcome) {
        var updated = new ArrayList<>(history);
        updated.add(outcome);
        return new RequirementItem(id, text, sourceRef, currentScore, outcome.verdict(), updated);
    }

    public RequirementItem withScore(Double score) {
        return new RequirementItem(id, text, sourceRef, score, verdict, history);
    }

    public RequirementItem withText(String newText) {
        return new RequirementItem(id, newText, sourceRef, currentScore, verdict, history);
    }
}
