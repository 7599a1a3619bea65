package com.reqflow.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.reqflow.core.model.ClarificationQuestion;
import com.reqflow.core.model.PhaseOutcome;
import com.reqflow.core.model.PhaseStats;
import com.reqflow.core.model.RequirementItem;
import com.reqflow.core.model.WorkflowSnapshot;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON response for workflow endpoints.
 */
public record WorkflowResponse(
    @JsonProperty("correlation_id") String correlationId,
    String phase,
    @JsonProperty("failure_reason") String failureReason,
    @JsonProperty("failure_detail") String failureDetail,
    @JsonProperty("started_at") String startedAt,
    @JsonProperty("ended_at") String endedAt,
    List<ItemResponse> items,
    @JsonProperty("phase_stats") Map<String, PhaseStats> phaseStats,
    @JsonProperty("pending_questions") List<QuestionResponse> pendingQuestions
) {

    public record ItemResponse(
        String id,
        String text,
        @JsonProperty("source_ref") String sourceRef,
        Double score,
        String verdict,
        List<OutcomeResponse> history
    ) {}

    public record OutcomeResponse(
        String phase,
        Double score,
        String verdict,
        String detail,
        int attempts
    ) {}

    public record QuestionResponse(
        @JsonProperty("question_id") String questionId,
        @JsonProperty("item_id") String itemId,
        String kind,
        String prompt,
        List<String> options,
        @JsonProperty("context_hint") String contextHint,
        String priority
    ) {}

    static WorkflowResponse from(WorkflowSnapshot snapshot, List<ClarificationQuestion> pending) {
        var stats = new LinkedHashMap<String, PhaseStats>();
        snapshot.phaseStats().forEach((phase, s) -> stats.put(phase.configKey(), s));
        return new WorkflowResponse(
                snapshot.correlationId(),
                snapshot.phase().configKey(),
                snapshot.failureReason() != null ? snapshot.failureReason().name() : null,
                snapshot.failureDetail(),
                snapshot.startedAt() != null ? snapshot.startedAt().toString() : null,
                snapshot.endedAt() != null ? snapshot.endedAt().toString() : null,
                snapshot.items().stream().map(WorkflowResponse::toItem).toList(),
                stats,
                pending.stream().map(WorkflowResponse::toQuestion).toList()
        );
    }

    private static ItemResponse toItem(RequirementItem item) {
        return new ItemResponse(item.id(), item.text(), item.sourceRef(), item.currentScore(),
                item.verdict() != null ? item.verdict().wireName() : null,
                item.history().stream().map(WorkflowResponse::toOutcome).toList());
    }

    private static OutcomeResponse toOutcome(PhaseOutcome outcome) {
        return new OutcomeResponse(outcome.phase().configKey(), outcome.score(),
                outcome.verdict().wireName(), outcome.detail(), outcome.attempts());
    }

    private static QuestionResponse toQuestion(ClarificationQuestion question) {
        return new QuestionResponse(question.questionId(), question.itemId(),
                question.kind().name().toLowerCase(), question.prompt(), question.options(),
                question.contextHint(), question.priority().name());
    }
}
