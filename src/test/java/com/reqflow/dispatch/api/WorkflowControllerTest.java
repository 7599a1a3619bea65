package com.reqflow.dispatch.api;

import com.reqflow.core.clarification.AnswerResult;
import com.reqflow.core.engine.CancelResult;
import com.reqflow.core.engine.SubmitResult;
import com.reqflow.core.engine.WorkflowOrchestrator;
import com.reqflow.core.engine.WorkflowSubmission;
import com.reqflow.core.model.ClarificationQuestion;
import com.reqflow.core.model.IssueKind;
import com.reqflow.core.model.PhaseOutcome;
import com.reqflow.core.model.PhaseStats;
import com.reqflow.core.model.QuestionPriority;
import com.reqflow.core.model.RequirementItem;
import com.reqflow.core.model.Verdict;
import com.reqflow.core.model.WorkflowPhase;
import com.reqflow.core.model.WorkflowSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(WorkflowController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class WorkflowControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private WorkflowOrchestrator orchestrator;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    private static SubmitResult accepted(String id) {
        return new SubmitResult(SubmitResult.Status.ACCEPTED, id, new CompletableFuture<>());
    }

    private static WorkflowSnapshot snapshot(String id) {
        var item = new RequirementItem("REQ-001", "The system shall export PDF reports.", "srs.md:3", 0.82,
                Verdict.PASS, List.of(new PhaseOutcome(WorkflowPhase.VALIDATING, 0.82, Verdict.PASS, "ok", 1)));
        return new WorkflowSnapshot(id, WorkflowPhase.QA_REVIEW, null, null,
                Instant.parse("2026-01-01T10:00:00Z"), null, List.of(item),
                Map.of(WorkflowPhase.VALIDATING, new PhaseStats(1, 1, 0, 0, 0, 0.82)));
    }

    // ── POST /api/v1/workflows ───────────────────────────────────────

    @Test
    @DisplayName("POST /workflows returns 202 Accepted with correlation_id")
    void submitWorkflow() throws Exception {
        when(orchestrator.submit(any())).thenReturn(accepted("RF-2026-0001"));

        mockMvc.perform(post("/api/v1/workflows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"items":[{"text":"The system shall export PDF reports."},
                                          {"id":"R-9","text":"Users log in with SSO.","source_ref":"p.2"}],
                                 "config":{"max_attempts":2,"per_item_timeout":30,"pass_threshold":0.8}}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.correlation_id").value("RF-2026-0001"))
                .andExpect(jsonPath("$.status").value("pending"));

        ArgumentCaptor<WorkflowSubmission> captor = ArgumentCaptor.forClass(WorkflowSubmission.class);
        verify(orchestrator).submit(captor.capture());
        var submission = captor.getValue();
        assertNull(submission.correlationId());
        assertEquals(List.of("REQ-001", "R-9"), submission.items().stream().map(RequirementItem::id).toList());
        assertEquals("p.2", submission.items().get(1).sourceRef());
        assertEquals(2, submission.overrides().maxAttempts());
        assertEquals(Duration.ofSeconds(30), submission.overrides().perItemTimeout());
        assertEquals(0.8, submission.overrides().passThreshold());
    }

    @Test
    @DisplayName("POST /workflows with documents passes them through for mining")
    void submitDocuments() throws Exception {
        when(orchestrator.submit(any())).thenReturn(accepted("batch-7"));

        mockMvc.perform(post("/api/v1/workflows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"correlation_id":"batch-7","documents":[{"content":"# SRS\\nThe system shall ..."}]}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.correlation_id").value("batch-7"));

        ArgumentCaptor<WorkflowSubmission> captor = ArgumentCaptor.forClass(WorkflowSubmission.class);
        verify(orchestrator).submit(captor.capture());
        assertEquals("batch-7", captor.getValue().correlationId());
        assertEquals("DOC-1", captor.getValue().documents().get(0).id());
    }

    @Test
    @DisplayName("POST /workflows without items or documents returns 400")
    void submitEmpty() throws Exception {
        mockMvc.perform(post("/api/v1/workflows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
        verify(orchestrator, never()).submit(any());
    }

    @Test
    @DisplayName("POST /workflows with a blank requirement text returns 400")
    void submitBlankText() throws Exception {
        mockMvc.perform(post("/api/v1/workflows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\":[{\"id\":\"R1\",\"text\":\" \"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Requirement text is required"));
    }

    @Test
    @DisplayName("POST /workflows with invalid overrides returns 400")
    void submitInvalidOverrides() throws Exception {
        when(orchestrator.submit(any())).thenThrow(new IllegalArgumentException("maxAttempts must be at least 1: 0"));

        mockMvc.perform(post("/api/v1/workflows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\":[{\"text\":\"x\"}],\"config\":{\"max_attempts\":0}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("maxAttempts")));
    }

    @Test
    @DisplayName("POST /workflows for a running correlation id returns 409")
    void submitDuplicate() throws Exception {
        when(orchestrator.submit(any())).thenReturn(
                new SubmitResult(SubmitResult.Status.REJECTED_DUPLICATE, "batch-7", null));

        mockMvc.perform(post("/api/v1/workflows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"correlation_id\":\"batch-7\",\"items\":[{\"text\":\"x\"}]}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.correlation_id").value("batch-7"));
    }

    // ── GET /api/v1/workflows ────────────────────────────────────────

    @Test
    @DisplayName("GET /workflows lists snapshots")
    void listWorkflows() throws Exception {
        when(orchestrator.list()).thenReturn(List.of(snapshot("RF-1"), snapshot("RF-2")));

        mockMvc.perform(get("/api/v1/workflows"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[1].correlation_id").value("RF-2"));
    }

    @Test
    @DisplayName("GET /workflows/{id} returns the snapshot with items, stats and pending questions")
    void getWorkflow() throws Exception {
        when(orchestrator.status("RF-1")).thenReturn(Optional.of(snapshot("RF-1")));
        when(orchestrator.pendingQuestions("RF-1")).thenReturn(List.of(new ClarificationQuestion(
                "Q-REQ-001-1", "RF-1", "REQ-001", IssueKind.DUPLICATE, "Duplicate?",
                List.of("keep both", "merge", "drop"), null, QuestionPriority.HIGH)));

        mockMvc.perform(get("/api/v1/workflows/RF-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("qa-review"))
                .andExpect(jsonPath("$.started_at").value("2026-01-01T10:00:00Z"))
                .andExpect(jsonPath("$.items[0].verdict").value("pass"))
                .andExpect(jsonPath("$.items[0].source_ref").value("srs.md:3"))
                .andExpect(jsonPath("$.items[0].history[0].phase").value("validating"))
                .andExpect(jsonPath("$.phase_stats.validating.passed").value(1))
                .andExpect(jsonPath("$.pending_questions[0].question_id").value("Q-REQ-001-1"))
                .andExpect(jsonPath("$.pending_questions[0].kind").value("duplicate"));
    }

    @Test
    @DisplayName("GET /workflows/{id} returns 404 for unknown workflow")
    void getWorkflowNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/workflows/RF-FAKE"))
                .andExpect(status().isNotFound());
    }

    // ── POST /api/v1/workflows/{id}/cancel ───────────────────────────

    @Test
    @DisplayName("POST /workflows/{id}/cancel returns 200 for an active workflow")
    void cancel() throws Exception {
        when(orchestrator.cancel("RF-1")).thenReturn(CancelResult.OK);

        mockMvc.perform(post("/api/v1/workflows/RF-1/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("cancelled"));
    }

    @Test
    @DisplayName("POST /workflows/{id}/cancel returns 404 when nothing is running")
    void cancelNotFound() throws Exception {
        when(orchestrator.cancel("RF-1")).thenReturn(CancelResult.NOT_FOUND);

        mockMvc.perform(post("/api/v1/workflows/RF-1/cancel"))
                .andExpect(status().isNotFound());
    }

    // ── POST /api/v1/workflows/{id}/clarifications/{questionId} ──────

    @Test
    @DisplayName("answering an open question returns 200")
    void answer() throws Exception {
        when(orchestrator.answerClarification("RF-1", "Q-R1-1", "merge")).thenReturn(AnswerResult.OK);

        mockMvc.perform(post("/api/v1/workflows/RF-1/clarifications/Q-R1-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\":\"merge\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.question_id").value("Q-R1-1"))
                .andExpect(jsonPath("$.status").value("answered"));
    }

    @Test
    @DisplayName("answering a resolved question returns 409")
    void answerTwice() throws Exception {
        when(orchestrator.answerClarification("RF-1", "Q-R1-1", "drop")).thenReturn(AnswerResult.ALREADY_ANSWERED);

        mockMvc.perform(post("/api/v1/workflows/RF-1/clarifications/Q-R1-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\":\"drop\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("answering an unknown question returns 404, a blank answer 400")
    void answerErrors() throws Exception {
        when(orchestrator.answerClarification(any(), any(), any())).thenReturn(AnswerResult.NOT_FOUND);

        mockMvc.perform(post("/api/v1/workflows/RF-1/clarifications/Q-404")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\":\"merge\"}"))
                .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/v1/workflows/RF-1/clarifications/Q-R1-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\":\"\"}"))
                .andExpect(status().isBadRequest());
    }

    // ── GET /api/v1/workflows/{id}/events ────────────────────────────

    @Test
    @DisplayName("GET /workflows/{id}/events returns 404 for unknown workflow")
    void sseNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/workflows/RF-FAKE/events"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /workflows/{id}/events resumes after Last-Event-ID")
    void sseResumes() throws Exception {
        when(orchestrator.status("RF-1")).thenReturn(Optional.of(snapshot("RF-1")));
        when(sseStreamingService.createEmitter("RF-1", 7L)).thenReturn(new SseEmitter(0L));

        mockMvc.perform(get("/api/v1/workflows/RF-1/events").header("Last-Event-ID", "7"))
                .andExpect(status().isOk());

        verify(sseStreamingService).createEmitter("RF-1", 7L);
    }

    @Test
    @DisplayName("Last-Event-ID parsing falls back to 0")
    void parseSequence() {
        assertEquals(0L, WorkflowController.parseSequence(null));
        assertEquals(0L, WorkflowController.parseSequence(" "));
        assertEquals(0L, WorkflowController.parseSequence("abc"));
        assertEquals(0L, WorkflowController.parseSequence("-4"));
        assertEquals(12L, WorkflowController.parseSequence(" 12 "));
    }
}
