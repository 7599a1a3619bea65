package com.reqflow.dispatch.api;

import com.reqflow.core.clarification.AnswerResult;
import com.reqflow.core.engine.CancelResult;
import com.reqflow.core.engine.SubmitResult;
import com.reqflow.core.engine.WorkflowOrchestrator;
import com.reqflow.core.engine.WorkflowSubmission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

/**
 * REST controller for workflow lifecycle operations.
 */
@RestController
@RequestMapping("/api/v1/workflows")
public class WorkflowController {

    private static final Logger log = LoggerFactory.getLogger(WorkflowController.class);

    private final WorkflowOrchestrator orchestrator;
    private final SseStreamingService sseStreamingService;

    public WorkflowController(WorkflowOrchestrator orchestrator, SseStreamingService sseStreamingService) {
        this.orchestrator = orchestrator;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/workflows: Submit requirements or documents. Runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> submitWorkflow(@RequestBody WorkflowRequest request) {
        if (request == null || request.isEmpty()) {
            return ResponseEntity.badRequest().body(
                    Map.of("error", "At least one item or document is required"));
        }

        SubmitResult result;
        try {
            WorkflowSubmission submission = request.toSubmission();
            result = orchestrator.submit(submission);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        if (!result.isAccepted()) {
            log.info("Rejected duplicate submission for {}", result.correlationId());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "error", "Workflow already running",
                    "correlation_id", result.correlationId()));
        }

        log.info("Accepted workflow {}", result.correlationId());
        return ResponseEntity.accepted().body(Map.of(
                "correlation_id", result.correlationId(),
                "status", "pending"));
    }

    /**
     * GET /api/v1/workflows: List active and recently finished workflows.
     */
    @GetMapping
    public ResponseEntity<List<WorkflowResponse>> listWorkflows() {
        List<WorkflowResponse> list = orchestrator.list().stream()
                .map(snapshot -> WorkflowResponse.from(snapshot,
                        orchestrator.pendingQuestions(snapshot.correlationId())))
                .toList();
        return ResponseEntity.ok(list);
    }

    /**
     * GET /api/v1/workflows/{id}: Current snapshot with per-item outcomes.
     */
    @GetMapping("/{id}")
    public ResponseEntity<WorkflowResponse> getWorkflow(@PathVariable String id) {
        return orchestrator.status(id)
                .map(snapshot -> ResponseEntity.ok(
                        WorkflowResponse.from(snapshot, orchestrator.pendingQuestions(id))))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * POST /api/v1/workflows/{id}/cancel: Cancel a running workflow.
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, String>> cancelWorkflow(@PathVariable String id) {
        if (orchestrator.cancel(id) == CancelResult.NOT_FOUND) {
            return ResponseEntity.notFound().build();
        }
        log.info("Workflow {} cancelled via API", id);
        return ResponseEntity.ok(Map.of(
                "correlation_id", id,
                "status", "cancelled"));
    }

    /**
     * POST /api/v1/workflows/{id}/clarifications/{questionId}: Answer a pending question.
     */
    @PostMapping("/{id}/clarifications/{questionId}")
    public ResponseEntity<Map<String, String>> answerClarification(@PathVariable String id,
                                                                   @PathVariable String questionId,
                                                                   @RequestBody ClarificationAnswerRequest request) {
        if (request == null || request.answer() == null || request.answer().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Answer is required"));
        }

        AnswerResult result = orchestrator.answerClarification(id, questionId, request.answer());
        return switch (result) {
            case OK -> ResponseEntity.ok(Map.of(
                    "correlation_id", id,
                    "question_id", questionId,
                    "status", "answered"));
            case ALREADY_ANSWERED -> ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "error", "Question already resolved",
                    "question_id", questionId));
            case NOT_FOUND -> ResponseEntity.notFound().build();
        };
    }

    /**
     * GET /api/v1/workflows/{id}/events: SSE stream of workflow events. A reconnecting client
     * sends {@code Last-Event-ID} to resume after the last event it received.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String id,
                                                   @RequestHeader(value = "Last-Event-ID", required = false)
                                                   String lastEventId) {
        if (orchestrator.status(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(id, parseSequence(lastEventId)));
    }

    static long parseSequence(String lastEventId) {
        if (lastEventId == null || lastEventId.isBlank()) {
            return 0L;
        }
        try {
            return Math.max(0L, Long.parseLong(lastEventId.trim()));
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed Last-Event-ID '{}'", lastEventId);
            return 0L;
        }
    }
}
