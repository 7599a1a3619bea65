package com.reqflow.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Nodes and edges produced by a graph build.
 */
public record KnowledgeGraph(List<GraphNode> nodes, List<GraphEdge> edges) implements Serializable {

    public KnowledgeGraph {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }
}
