package com.reqflow.core.llm;

import java.util.List;

/**
 * Shapes the model is asked to answer in.
 */
public final class LlmResponses {

    private LlmResponses() {}

    public record CriterionScore(String criterion, double score, boolean passed, String feedback) {}

    public record EvaluationResponse(double score, String verdict, List<CriterionScore> criteria) {}

    public record SuggestionResponse(List<String> atoms) {}

    public record RewriteResponse(String text) {}

    public record MinedRequirement(String text, String sourceRef) {}

    public record MiningResponse(List<MinedRequirement> requirements) {}
}
