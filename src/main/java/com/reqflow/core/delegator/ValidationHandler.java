package com.reqflow.core.delegator;

import com.reqflow.core.capability.RequirementEvaluator;
import com.reqflow.core.model.RequirementItem;
import com.reqflow.core.pool.HandlerContext;
import com.reqflow.core.pool.PhaseHandler;

/**
 * Evaluates one requirement; it passes iff its score reaches the threshold.
 */
public class ValidationHandler implements PhaseHandler<RequirementItem, ValidationVerdict> {

    private final RequirementEvaluator evaluator;
    private final double passThreshold;

    public ValidationHandler(RequirementEvaluator evaluator, double passThreshold) {
        this.evaluator = evaluator;
        this.passThreshold = passThreshold;
    }

    @Override
    public ValidationVerdict handle(RequirementItem item, HandlerContext ctx) {
        ctx.token().throwIfCancelled();
        return new ValidationVerdict(evaluator.evaluate(item.text()), passThreshold);
    }
}
