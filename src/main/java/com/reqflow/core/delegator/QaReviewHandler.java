package com.reqflow.core.delegator;

import com.reqflow.core.capability.KnowledgeGraphService;
import com.reqflow.core.model.CriterionResult;
import com.reqflow.core.model.Evaluation;
import com.reqflow.core.model.IssueKind;
import com.reqflow.core.model.QaIssue;
import com.reqflow.core.model.RequirementItem;
import com.reqflow.core.model.SearchHit;
import com.reqflow.core.pool.HandlerContext;
import com.reqflow.core.pool.PhaseHandler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Looks for issues that still need a human: a score below the pass threshold, or a near
 * duplicate of an earlier requirement in the same run.
 * <p>
 * A duplicate pair is reported once, on the later of the two items, so that only one side
 * is asked whether to keep, merge or drop.
 */
public class QaReviewHandler implements PhaseHandler<RequirementItem, QaReport> {

    private final KnowledgeGraphService knowledgeGraph;
    private final String scope;
    private final double passThreshold;
    private final double duplicateThreshold;
    private final int topK;
    private final Map<String, Evaluation> evaluations;
    private final Map<String, Integer> positions = new HashMap<>();

    public QaReviewHandler(KnowledgeGraphService knowledgeGraph, String scope, double passThreshold,
                           double duplicateThreshold, int topK, Map<String, Evaluation> evaluations,
                           List<String> itemOrder) {
        this.knowledgeGraph = knowledgeGraph;
        this.scope = scope;
        this.passThreshold = passThreshold;
        this.duplicateThreshold = duplicateThreshold;
        this.topK = topK;
        this.evaluations = Map.copyOf(evaluations);
        for (int i = 0; i < itemOrder.size(); i++) {
            positions.put(itemOrder.get(i), i);
        }
    }

    @Override
    public QaReport handle(RequirementItem item, HandlerContext ctx) {
        ctx.token().throwIfCancelled();
        var issues = new ArrayList<QaIssue>();

        Double score = item.currentScore();
        if (score == null || score < passThreshold) {
            Evaluation evaluation = evaluations.get(item.id());
            String criterion = evaluation != null
                    ? evaluation.weakestCriterion().map(CriterionResult::criterion).orElse(null)
                    : null;
            String detail = score == null
                    ? "not scored"
                    : String.format("score %.2f below threshold %.2f", score, passThreshold);
            issues.add(new QaIssue(item.id(), IssueKind.LOW_CONFIDENCE, detail, List.of(), criterion));
        }

        var duplicates = new ArrayList<String>();
        int own = positions.getOrDefault(item.id(), Integer.MAX_VALUE);
        for (SearchHit hit : knowledgeGraph.search(scope, item.text(), topK)) {
            Integer other = positions.get(hit.itemId());
            if (other != null && other < own && hit.similarity() >= duplicateThreshold) {
                duplicates.add(hit.itemId());
            }
        }
        if (!duplicates.isEmpty()) {
            issues.add(new QaIssue(item.id(), IssueKind.DUPLICATE,
                    "possible duplicate of " + String.join(", ", duplicates), duplicates, null));
        }
        return new QaReport(item.id(), score, issues);
    }
}
