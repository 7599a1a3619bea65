package com.reqflow.core.clarification;

import com.reqflow.core.events.EventBroadcaster;
import com.reqflow.core.events.EventKind;
import com.reqflow.core.metrics.ReqflowMetrics;
import com.reqflow.core.model.ClarificationAnswer;
import com.reqflow.core.model.ClarificationQuestion;
import com.reqflow.core.pool.CancellationToken;
import com.reqflow.core.pool.WorkflowCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Holds clarification questions until a human answers them.
 * <p>
 * Each question resolves exactly once: by the first {@link #answer} call, by the default
 * {@code manual-review} answer when the wait times out, or by cancellation of the run. Only the
 * waiting requirement is suspended; other requirements and other runs keep going. Resolved
 * questions are remembered so late answers are reported as already answered, until the
 * correlation id is {@linkplain #forget forgotten}.
 */
@Component
public class ClarificationGate {

    private static final Logger log = LoggerFactory.getLogger(ClarificationGate.class);

    private final ConcurrentHashMap<String, PendingQuestion> questions = new ConcurrentHashMap<>();
    private final EventBroadcaster broadcaster;
    private final ReqflowMetrics metrics;
    private final Clock clock;

    @Autowired
    public ClarificationGate(EventBroadcaster broadcaster, ReqflowMetrics metrics) {
        this(broadcaster, metrics, Clock.systemUTC());
    }

    public ClarificationGate(EventBroadcaster broadcaster) {
        this(broadcaster, null, Clock.systemUTC());
    }

    ClarificationGate(EventBroadcaster broadcaster, ReqflowMetrics metrics, Clock clock) {
        this.broadcaster = broadcaster;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Registers a question and publishes it as a {@code question} event.
     *
     * @throws IllegalStateException if the question id is already registered for the run
     */
    public PendingQuestion open(ClarificationQuestion question) {
        var pending = new PendingQuestion(question);
        if (questions.putIfAbsent(key(question.correlationId(), question.questionId()), pending) != null) {
            throw new IllegalStateException("Question " + question.questionId() + " already open for "
                    + question.correlationId());
        }
        broadcaster.publish(question.correlationId(), EventKind.QUESTION, toPayload(question));
        log.info("Clarification question {} opened for {} ({})", question.questionId(),
                question.itemId(), question.kind());
        return pending;
    }

    /**
     * Blocks until the question resolves.
     *
     * @return the accepted answer, or the defaulted {@code manual-review} answer on timeout
     * @throws WorkflowCancelledException if the token is cancelled first
     */
    public ClarificationAnswer await(PendingQuestion pending, Duration timeout, CancellationToken token)
            throws InterruptedException {
        CancellationToken.Registration registration = token.onCancel(() -> pending.future
                .completeExceptionally(new WorkflowCancelledException(token.reason())));
        try {
            ClarificationAnswer answer;
            try {
                answer = pending.future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                var fallback = ClarificationAnswer.defaultFor(pending.question.questionId(), clock.instant());
                if (pending.future.complete(fallback)) {
                    log.warn("Clarification question {} timed out after {}s, defaulting to {}",
                            pending.question.questionId(), timeout.toSeconds(), fallback.value());
                    resolved(pending.question, fallback);
                }
                answer = pending.future.get();
            }
            return answer;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof WorkflowCancelledException cancelled) {
                throw cancelled;
            }
            throw new IllegalStateException("Clarification wait failed", e.getCause());
        } finally {
            registration.remove();
        }
    }

    /**
     * Opens the question and waits for its resolution.
     */
    public ClarificationAnswer ask(ClarificationQuestion question, Duration timeout, CancellationToken token)
            throws InterruptedException {
        return await(open(question), timeout, token);
    }

    /**
     * Offers an answer. The first answer wins.
     */
    public AnswerResult answer(String correlationId, String questionId, String value) {
        PendingQuestion pending = questions.get(key(correlationId, questionId));
        if (pending == null) {
            return AnswerResult.NOT_FOUND;
        }
        var answer = new ClarificationAnswer(questionId, value, clock.instant(), false);
        if (!pending.future.complete(answer)) {
            log.info("Ignoring answer for {}: already resolved", questionId);
            return AnswerResult.ALREADY_ANSWERED;
        }
        resolved(pending.question, answer);
        return AnswerResult.OK;
    }

    /**
     * Questions of the run that are still waiting for an answer.
     */
    public List<ClarificationQuestion> pending(String correlationId) {
        return questions.values().stream()
                .filter(p -> p.question.correlationId().equals(correlationId) && !p.future.isDone())
                .map(PendingQuestion::question)
                .toList();
    }

    /**
     * Cancels every unresolved question of the run.
     *
     * @return number of questions cancelled
     */
    public int cancelAll(String correlationId, String reason) {
        int cancelled = 0;
        for (PendingQuestion pending : questions.values()) {
            if (pending.question.correlationId().equals(correlationId)
                    && pending.future.completeExceptionally(new WorkflowCancelledException(reason))) {
                cancelled++;
            }
        }
        return cancelled;
    }

    /**
     * Drops every question of the run, resolved or not.
     */
    public void forget(String correlationId) {
        cancelAll(correlationId, "forgotten");
        questions.values().removeIf(p -> p.question.correlationId().equals(correlationId));
    }

    private void resolved(ClarificationQuestion question, ClarificationAnswer answer) {
        if (metrics != null) {
            metrics.recordClarification(answer.defaulted());
        }
        var payload = new HashMap<String, Object>();
        payload.put("type", "clarification_resolved");
        payload.put("questionId", question.questionId());
        payload.put("itemId", question.itemId());
        payload.put("answer", answer.value());
        payload.put("defaulted", answer.defaulted());
        broadcaster.publish(question.correlationId(), EventKind.AGENT_MESSAGE, payload);
    }

    private static Map<String, Object> toPayload(ClarificationQuestion question) {
        var payload = new HashMap<String, Object>();
        payload.put("questionId", question.questionId());
        payload.put("itemId", question.itemId());
        payload.put("kind", question.kind().name().toLowerCase());
        payload.put("prompt", question.prompt());
        payload.put("options", question.options());
        payload.put("priority", question.priority().name());
        if (question.contextHint() != null) {
            payload.put("contextHint", question.contextHint());
        }
        return payload;
    }

    private static String key(String correlationId, String questionId) {
        return correlationId + "/" + questionId;
    }

    /**
     * A registered question and its single-resolution future.
     */
    public static final class PendingQuestion {
        private final ClarificationQuestion question;
        private final CompletableFuture<ClarificationAnswer> future = new CompletableFuture<>();

        PendingQuestion(ClarificationQuestion question) {
            this.question = question;
        }

        public ClarificationQuestion question() {
            return question;
        }

        public boolean isResolved() {
            return future.isDone();
        }
    }
}
