package com.reqflow.core.delegator;

import com.reqflow.core.capability.KnowledgeGraphService;
import com.reqflow.core.pool.HandlerContext;
import com.reqflow.core.pool.PhaseHandler;

/**
 * Adds one batch of requirements to the run's knowledge graph.
 */
public class KgBuildHandler implements PhaseHandler<KgBatch, GraphYield> {

    private final KnowledgeGraphService knowledgeGraph;
    private final String scope;

    public KgBuildHandler(KnowledgeGraphService knowledgeGraph, String scope) {
        this.knowledgeGraph = knowledgeGraph;
        this.scope = scope;
    }

    @Override
    public GraphYield handle(KgBatch batch, HandlerContext ctx) {
        ctx.token().throwIfCancelled();
        var graph = knowledgeGraph.buildGraph(scope, batch.items());
        return new GraphYield(batch.items().size(), graph.nodes().size(), graph.edges().size());
    }
}
