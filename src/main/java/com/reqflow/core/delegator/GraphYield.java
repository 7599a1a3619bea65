package com.reqflow.core.delegator;

import com.reqflow.core.model.Verdict;

/**
 * Size of the graph fragment built for one batch.
 */
public record GraphYield(int items, int nodes, int edges) implements HandlerResult {

    @Override
    public Verdict verdict() {
        return Verdict.PASS;
    }

    @Override
    public Double score() {
        return null;
    }

    @Override
    public String detail() {
        return "Indexed " + items + " requirement(s): " + nodes + " node(s), " + edges + " edge(s)";
    }
}
