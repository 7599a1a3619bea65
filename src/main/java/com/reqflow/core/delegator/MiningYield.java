package com.reqflow.core.delegator;

import com.reqflow.core.model.RequirementItem;
import com.reqflow.core.model.Verdict;

import java.util.List;

/**
 * Requirements mined from one document.
 */
public record MiningYield(String documentId, List<RequirementItem> items) implements HandlerResult {

    public MiningYield {
        items = items != null ? List.copyOf(items) : List.of();
    }

    @Override
    public Verdict verdict() {
        return items.isEmpty() ? Verdict.FAIL : Verdict.PASS;
    }

    @Override
    public Double score() {
        return null;
    }

    @Override
    public String detail() {
        return "Mined " + items.size() + " requirement(s) from " + documentId;
    }
}
