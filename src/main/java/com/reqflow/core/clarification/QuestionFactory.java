package com.reqflow.core.clarification;

import com.reqflow.core.model.ClarificationQuestion;
import com.reqflow.core.model.IssueKind;
import com.reqflow.core.model.QaIssue;
import com.reqflow.core.model.QuestionPriority;
import com.reqflow.core.model.RequirementItem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Turns QA issues into clarification questions, most urgent first.
 * <p>
 * Low-confidence questions are phrased after the weakest failing criterion and accept either
 * one of the suggested options or free text that replaces the requirement. Duplicate questions
 * offer {@code keep both}, {@code merge} or {@code drop}. Question ids are
 * {@code Q-<itemId>-<n>} in priority order.
 */
public final class QuestionFactory {

    static final String ACCEPT = "accept as is";
    static final String REJECT = "reject";
    static final List<String> DUPLICATE_OPTIONS = List.of("keep both", "merge", "drop");

    private static final Map<String, Template> TEMPLATES = Map.of(
            "measurability", new Template(QuestionPriority.CRITICAL,
                    "Which concrete, measurable values should apply to \"%s\"?",
                    "The requirement contains no quantifiable metric.",
                    List.of("Maximum response time in seconds", "Minimum availability in percent",
                            "Maximum number of concurrent users")),
            "testability", new Template(QuestionPriority.CRITICAL,
                    "How can it be verified that \"%s\" works correctly?",
                    "Acceptance criteria for verification are missing.",
                    List.of("Describe a GIVEN-WHEN-THEN test case", "Give manual test instructions",
                            "No acceptance criteria needed")),
            "clarity", new Template(QuestionPriority.HIGH,
                    "What exactly is meant by \"%s\"?",
                    "A term is ambiguous or unclear in this context.",
                    List.of("Define the term", "Remove the term", "The term is standard in this domain")),
            "atomic", new Template(QuestionPriority.HIGH,
                    "\"%s\" covers several aspects. Which one should be kept?",
                    "Atomic requirements address exactly one thing.",
                    List.of("Split into separate requirements", "Keep only the main aspect",
                            "The aspects are inseparable")),
            "unambiguous", new Template(QuestionPriority.MEDIUM,
                    "\"%s\" uses vague wording. What is the precise meaning?",
                    "Words such as fast, easy or approximately are not precise.",
                    List.of("Give a concrete value", "Name a reference for comparison"))
    );

    private QuestionFactory() {}

    public static List<ClarificationQuestion> questionsFor(String correlationId, RequirementItem item,
                                                           List<QaIssue> issues) {
        var questions = new ArrayList<ClarificationQuestion>();
        for (QaIssue issue : issues) {
            questions.add(issue.kind() == IssueKind.DUPLICATE
                    ? duplicateQuestion(correlationId, item, issue)
                    : lowConfidenceQuestion(correlationId, item, issue));
        }
        questions.sort(Comparator.comparingInt(q -> q.priority().rank()));

        var numbered = new ArrayList<ClarificationQuestion>(questions.size());
        for (int i = 0; i < questions.size(); i++) {
            var q = questions.get(i);
            numbered.add(new ClarificationQuestion("Q-" + item.id() + "-" + (i + 1), q.correlationId(),
                    q.itemId(), q.kind(), q.prompt(), q.options(), q.contextHint(), q.priority()));
        }
        return numbered;
    }

    private static ClarificationQuestion lowConfidenceQuestion(String correlationId, RequirementItem item,
                                                               QaIssue issue) {
        String subject = abbreviate(item.text());
        Template template = issue.criterion() != null ? TEMPLATES.get(issue.criterion().toLowerCase()) : null;
        if (template == null) {
            String criterion = issue.criterion() != null ? issue.criterion() : "quality";
            var options = List.of(ACCEPT, REJECT);
            return new ClarificationQuestion(null, correlationId, item.id(), IssueKind.LOW_CONFIDENCE,
                    "How can the criterion '" + criterion + "' be met for \"" + subject
                            + "\"? Answer with a revised requirement or choose an option.",
                    options, issue.detail(), QuestionPriority.MEDIUM);
        }
        var options = new ArrayList<>(template.suggestions());
        options.add(ACCEPT);
        options.add(REJECT);
        return new ClarificationQuestion(null, correlationId, item.id(), IssueKind.LOW_CONFIDENCE,
                String.format(template.pattern(), subject), options,
                template.context() + " (" + issue.detail() + ")", template.priority());
    }

    private static ClarificationQuestion duplicateQuestion(String correlationId, RequirementItem item,
                                                           QaIssue issue) {
        return new ClarificationQuestion(null, correlationId, item.id(), IssueKind.DUPLICATE,
                "\"" + abbreviate(item.text()) + "\" looks like a duplicate of "
                        + String.join(", ", issue.relatedIds()) + ". Keep both, merge or drop it?",
                DUPLICATE_OPTIONS, issue.detail(), QuestionPriority.HIGH);
    }

    private static String abbreviate(String text) {
        String trimmed = text.strip();
        return trimmed.length() <= 80 ? trimmed : trimmed.substring(0, 77) + "...";
    }

    private record Template(QuestionPriority priority, String pattern, String context, List<String> suggestions) {}
}
