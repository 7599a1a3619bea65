package com.reqflow.core.delegator;

import com.reqflow.core.clarification.ClarificationGate;
import com.reqflow.core.model.ClarificationAnswer;
import com.reqflow.core.model.ClarificationQuestion;
import com.reqflow.core.model.IssueKind;
import com.reqflow.core.model.Verdict;
import com.reqflow.core.pool.HandlerContext;
import com.reqflow.core.pool.PhaseHandler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Locale;
import java.util.Set;

/**
 * Publishes every question of one requirement and waits for the answers, sharing one
 * clarification timeout across them.
 * <p>
 * The requirement fails if any answer rejects or drops it, or if a question timed out and
 * was defaulted to manual review. A free-text answer to a low-confidence question (one that is
 * not among the offered options) becomes the requirement's new text.
 */
public class ClarificationHandler implements PhaseHandler<ClarificationTask, ClarificationResolution> {

    static final Set<String> REJECTING_ANSWERS = Set.of("reject", "drop");

    private final ClarificationGate gate;
    private final Duration timeout;

    public ClarificationHandler(ClarificationGate gate, Duration timeout) {
        this.gate = gate;
        this.timeout = timeout;
    }

    @Override
    public ClarificationResolution handle(ClarificationTask task, HandlerContext ctx) throws InterruptedException {
        ctx.token().throwIfCancelled();
        var pending = new ArrayList<ClarificationGate.PendingQuestion>();
        for (ClarificationQuestion question : task.questions()) {
            pending.add(gate.open(question));
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        var answers = new ArrayList<ClarificationAnswer>();
        Verdict verdict = Verdict.PASS;
        String revisedText = null;
        for (ClarificationGate.PendingQuestion question : pending) {
            Duration remaining = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
            ClarificationAnswer answer = gate.await(question, remaining, ctx.token());
            answers.add(answer);
            if (isRejecting(answer)) {
                verdict = Verdict.FAIL;
            } else if (question.question().kind() == IssueKind.LOW_CONFIDENCE
                    && !question.question().isOption(answer.value())) {
                revisedText = answer.value().trim();
            }
        }
        return new ClarificationResolution(task.itemId(), answers, verdict, revisedText);
    }

    private static boolean isRejecting(ClarificationAnswer answer) {
        return answer.defaulted()
                || REJECTING_ANSWERS.contains(answer.value().trim().toLowerCase(Locale.ROOT));
    }
}
