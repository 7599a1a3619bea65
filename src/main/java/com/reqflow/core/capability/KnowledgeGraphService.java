package com.reqflow.core.capability;

import com.reqflow.core.model.KnowledgeGraph;
import com.reqflow.core.model.RequirementItem;
import com.reqflow.core.model.SearchHit;

import java.util.List;

/**
 * Knowledge graph and similarity search over requirements, partitioned by scope
 * (the workflow correlation id). Builds for the same scope accumulate.
 */
public interface KnowledgeGraphService {

    KnowledgeGraph buildGraph(String scope, List<RequirementItem> items);

    List<SearchHit> search(String scope, String query, int topK);

    /** Drops everything stored for the scope. */
    void release(String scope);
}
