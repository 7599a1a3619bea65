package com.reqflow.core.delegator;

import com.reqflow.core.capability.RequirementEvaluator;
import com.reqflow.core.capability.RequirementRewriter;
import com.reqflow.core.metrics.ReqflowMetrics;
import com.reqflow.core.model.Evaluation;
import com.reqflow.core.model.RequirementItem;
import com.reqflow.core.pool.HandlerContext;
import com.reqflow.core.pool.PhaseHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites a failed requirement in rounds of suggest, rewrite and re-evaluate, stopping as
 * soon as a round reaches the pass threshold. Each round starts from the previous round's
 * text; the best-scoring text wins.
 */
public class RewriteHandler implements PhaseHandler<RequirementItem, RewriteYield> {

    private static final Logger log = LoggerFactory.getLogger(RewriteHandler.class);

    private final RequirementRewriter rewriter;
    private final RequirementEvaluator evaluator;
    private final double passThreshold;
    private final int maxRounds;
    private final ReqflowMetrics metrics;

    public RewriteHandler(RequirementRewriter rewriter, RequirementEvaluator evaluator,
                          double passThreshold, int maxRounds, ReqflowMetrics metrics) {
        this.rewriter = rewriter;
        this.evaluator = evaluator;
        this.passThreshold = passThreshold;
        this.maxRounds = maxRounds;
        this.metrics = metrics;
    }

    @Override
    public RewriteYield handle(RequirementItem item, HandlerContext ctx) {
        String text = item.text();
        String bestText = text;
        double bestScore = item.currentScore() != null ? item.currentScore() : 0.0;
        Evaluation bestEvaluation = null;
        int rounds = 0;

        while (rounds < maxRounds && bestScore < passThreshold) {
            ctx.token().throwIfCancelled();
            rounds++;
            var atoms = rewriter.suggest(text);
            String rewritten = rewriter.rewrite(text, atoms);
            if (rewritten == null || rewritten.isBlank()) {
                log.warn("Rewrite round {} for {} returned no text", rounds, item.id());
                continue;
            }
            ctx.token().throwIfCancelled();
            Evaluation evaluation = evaluator.evaluate(rewritten);
            log.debug("Rewrite round {} for {}: {} -> {}", rounds, item.id(), bestScore, evaluation.score());
            if (evaluation.score() > bestScore) {
                bestScore = evaluation.score();
                bestText = rewritten;
                bestEvaluation = evaluation;
            }
            text = rewritten;
        }

        if (metrics != null) {
            metrics.recordRewriteRounds(rounds);
        }
        return new RewriteYield(item.text(), bestText, item.currentScore(), bestScore, rounds,
                bestScore >= passThreshold, bestEvaluation);
    }
}
