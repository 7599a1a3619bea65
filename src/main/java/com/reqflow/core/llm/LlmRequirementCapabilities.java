package com.reqflow.core.llm;

import com.reqflow.core.capability.FatalCallException;
import com.reqflow.core.capability.RequirementEvaluator;
import com.reqflow.core.capability.RequirementMiner;
import com.reqflow.core.capability.RequirementRewriter;
import com.reqflow.core.capability.TransientCallException;
import com.reqflow.core.model.CriterionResult;
import com.reqflow.core.model.Evaluation;
import com.reqflow.core.model.RequirementItem;
import com.reqflow.core.model.SourceDocument;
import com.reqflow.core.model.Verdict;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Model-backed evaluate, suggest, rewrite and mine.
 * <p>
 * Failures are classified for the worker pool: rate limits, network errors and empty replies
 * are transient; unparseable replies and rejected requests are fatal.
 */
@Service
public class LlmRequirementCapabilities implements RequirementEvaluator, RequirementRewriter, RequirementMiner {

    static final List<String> CRITERIA = List.of(
            "atomic", "clarity", "testability", "measurability", "unambiguous",
            "concise", "consistent_language", "follows_template",
            "design_independent", "purpose_independent");

    private static final String EVALUATE_SYSTEM_PROMPT = """
            You are a requirements quality reviewer. Score the requirement against each criterion \
            (%s) from 0.0 to 1.0, mark a criterion passed when it scores at least 0.7, and give one \
            sentence of feedback per criterion. The overall score is the mean of the criterion scores. \
            The verdict is "pass" or "fail".""".formatted(String.join(", ", CRITERIA));

    private static final String SUGGEST_SYSTEM_PROMPT = """
            You are a requirements engineer. List short, atomic, actionable changes that would make \
            the requirement measurable, testable and unambiguous. Describe WHAT, not HOW.""";

    private static final String REWRITE_SYSTEM_PROMPT = """
            You are a requirements engineer. Rewrite the requirement applying the given suggestions. \
            Keep the original intent, produce a single requirement sentence in the form \
            "The system shall ...", and do not add implementation details.""";

    private static final String MINE_SYSTEM_PROMPT = """
            You extract software requirements from documents. Return every distinct functional or \
            non-functional requirement as one self-contained sentence. Use the section heading or \
            paragraph as sourceRef when available. Return an empty list when there are none.""";

    private final LlmService llm;

    public LlmRequirementCapabilities(LlmService llm) {
        this.llm = llm;
    }

    @Override
    public Evaluation evaluate(String text) {
        var response = classified("evaluate", () ->
                llm.structuredCall(EVALUATE_SYSTEM_PROMPT, "Requirement:\n" + text, LlmResponses.EvaluationResponse.class));
        var criteria = new ArrayList<CriterionResult>();
        if (response.criteria() != null) {
            for (var c : response.criteria()) {
                criteria.add(new CriterionResult(c.criterion(), clamp(c.score()), c.passed(), c.feedback()));
            }
        }
        Verdict verdict = "pass".equalsIgnoreCase(response.verdict()) ? Verdict.PASS : Verdict.FAIL;
        return new Evaluation(clamp(response.score()), verdict, criteria);
    }

    @Override
    public List<String> suggest(String text) {
        var response = classified("suggest", () ->
                llm.structuredCall(SUGGEST_SYSTEM_PROMPT, "Requirement:\n" + text, LlmResponses.SuggestionResponse.class));
        return response.atoms() != null ? List.copyOf(response.atoms()) : List.of();
    }

    @Override
    public String rewrite(String text, List<String> atoms) {
        String prompt = "Requirement:\n" + text + "\n\nSuggestions:\n- " + String.join("\n- ", atoms);
        var response = classified("rewrite", () ->
                llm.structuredCall(REWRITE_SYSTEM_PROMPT, prompt, LlmResponses.RewriteResponse.class));
        return response.text();
    }

    @Override
    public List<RequirementItem> mine(SourceDocument document) {
        var response = classified("mine", () ->
                llm.structuredCall(MINE_SYSTEM_PROMPT, "Document " + document.id() + ":\n" + document.content(),
                        LlmResponses.MiningResponse.class));
        var items = new ArrayList<RequirementItem>();
        if (response.requirements() != null) {
            for (var mined : response.requirements()) {
                if (mined.text() != null && !mined.text().isBlank()) {
                    items.add(RequirementItem.of(document.id() + "-" + (items.size() + 1), mined.text(), mined.sourceRef()));
                }
            }
        }
        return items;
    }

    static <T> T classified(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (TransientAiException | LlmEmptyResponseException | ResourceAccessException e) {
            throw new TransientCallException(operation + " failed: " + e.getMessage(), e);
        } catch (NonTransientAiException | LlmParseException e) {
            throw new FatalCallException(operation + " failed: " + e.getMessage(), e);
        }
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }
}
