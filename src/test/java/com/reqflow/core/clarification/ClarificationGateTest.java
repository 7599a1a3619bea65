package com.reqflow.core.clarification;

import com.reqflow.core.events.EventBroadcaster;
import com.reqflow.core.events.EventKind;
import com.reqflow.core.events.WorkflowEvent;
import com.reqflow.core.metrics.ReqflowMetrics;
import com.reqflow.core.model.ClarificationAnswer;
import com.reqflow.core.model.ClarificationQuestion;
import com.reqflow.core.model.IssueKind;
import com.reqflow.core.model.QuestionPriority;
import com.reqflow.core.pool.CancellationToken;
import com.reqflow.core.pool.WorkflowCancelledException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ClarificationGateTest {

    private EventBroadcaster broadcaster;
    private SimpleMeterRegistry registry;
    private ClarificationGate gate;

    @BeforeEach
    void setUp() {
        broadcaster = new EventBroadcaster();
        registry = new SimpleMeterRegistry();
        gate = new ClarificationGate(broadcaster, new ReqflowMetrics(registry), Clock.systemUTC());
    }

    private static ClarificationQuestion question(String correlationId, String id) {
        return new ClarificationQuestion(id, correlationId, "R1", IssueKind.LOW_CONFIDENCE,
                "What is meant?", List.of("accept as is", "reject"), "hint", QuestionPriority.HIGH);
    }

    @Test
    @DisplayName("open publishes a question event and lists the question as pending")
    void openPublishes() {
        var events = new ArrayList<WorkflowEvent>();
        broadcaster.subscribe("RF-1", events::add);

        gate.open(question("RF-1", "Q-1"));

        assertEquals(1, events.size());
        assertEquals(EventKind.QUESTION, events.get(0).kind());
        assertEquals("Q-1", events.get(0).payload().get("questionId"));
        assertEquals("HIGH", events.get(0).payload().get("priority"));
        assertEquals(List.of("accept as is", "reject"), events.get(0).payload().get("options"));
        assertEquals(1, gate.pending("RF-1").size());
        assertTrue(gate.pending("RF-2").isEmpty());
        assertThrows(IllegalStateException.class, () -> gate.open(question("RF-1", "Q-1")));
    }

    @Test
    @DisplayName("first answer wins; later answers are already answered")
    void firstAnswerWins() throws Exception {
        var pending = gate.open(question("RF-1", "Q-1"));

        assertEquals(AnswerResult.OK, gate.answer("RF-1", "Q-1", "accept as is"));
        assertEquals(AnswerResult.ALREADY_ANSWERED, gate.answer("RF-1", "Q-1", "reject"));

        var answer = gate.await(pending, Duration.ofSeconds(1), CancellationToken.none());
        assertEquals("accept as is", answer.value());
        assertFalse(answer.defaulted());
        assertTrue(pending.isResolved());
        assertTrue(gate.pending("RF-1").isEmpty());
        assertEquals(1.0, registry.find("reqflow.clarifications.total").tag("source", "user").counter().count());
    }

    @Test
    @DisplayName("concurrent answers resolve the question exactly once")
    void concurrentAnswers() throws Exception {
        gate.open(question("RF-1", "Q-1"));
        var ok = new AtomicInteger();
        var executor = Executors.newFixedThreadPool(8);
        try {
            var futures = new ArrayList<CompletableFuture<Void>>();
            for (int i = 0; i < 8; i++) {
                String value = "answer-" + i;
                futures.add(CompletableFuture.runAsync(() -> {
                    if (gate.answer("RF-1", "Q-1", value) == AnswerResult.OK) {
                        ok.incrementAndGet();
                    }
                }, executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, ok.get());
    }

    @Test
    @DisplayName("unknown questions are not found")
    void unknownQuestion() {
        assertEquals(AnswerResult.NOT_FOUND, gate.answer("RF-1", "Q-404", "x"));
    }

    @Test
    @DisplayName("timeout resolves with the manual-review default")
    void timeoutDefaults() throws Exception {
        var answer = gate.ask(question("RF-1", "Q-1"), Duration.ofMillis(50), CancellationToken.none());

        assertTrue(answer.defaulted());
        assertEquals(ClarificationAnswer.MANUAL_REVIEW, answer.value());
        assertEquals(AnswerResult.ALREADY_ANSWERED, gate.answer("RF-1", "Q-1", "late"));
        assertEquals(1.0, registry.find("reqflow.clarifications.total").tag("source", "timeout").counter().count());
    }

    @Test
    @DisplayName("answer arriving while waiting resumes the waiter")
    void answerWhileWaiting() throws Exception {
        var pending = gate.open(question("RF-1", "Q-1"));
        var waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return gate.await(pending, Duration.ofSeconds(10), CancellationToken.none());
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        Thread.sleep(50);
        assertEquals(AnswerResult.OK, gate.answer("RF-1", "Q-1", "reject"));
        assertEquals("reject", waiter.get(5, TimeUnit.SECONDS).value());
    }

    @Test
    @DisplayName("cancelling the token aborts the wait")
    void cancellation() {
        var token = CancellationToken.none();
        var pending = gate.open(question("RF-1", "Q-1"));
        var waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return gate.await(pending, Duration.ofSeconds(10), token);
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        token.cancel("run cancelled");

        var e = assertThrows(ExecutionException.class, () -> waiter.get(5, TimeUnit.SECONDS));
        assertInstanceOf(WorkflowCancelledException.class, e.getCause());
        assertEquals(AnswerResult.ALREADY_ANSWERED, gate.answer("RF-1", "Q-1", "too late"));
    }

    @Test
    @DisplayName("cancelAll resolves only the run's open questions; forget drops them")
    void cancelAllAndForget() {
        gate.open(question("RF-1", "Q-1"));
        gate.open(question("RF-1", "Q-2"));
        gate.open(question("RF-2", "Q-1"));
        gate.answer("RF-1", "Q-2", "accept as is");

        assertEquals(1, gate.cancelAll("RF-1", "finished"));
        assertEquals(1, gate.pending("RF-2").size());

        gate.forget("RF-1");
        assertEquals(AnswerResult.NOT_FOUND, gate.answer("RF-1", "Q-1", "x"));
        gate.open(question("RF-1", "Q-1"));
    }
}
