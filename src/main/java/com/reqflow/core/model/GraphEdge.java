package com.reqflow.core.model;

import java.io.Serializable;

/**
 * Directed knowledge-graph edge.
 */
public record GraphEdge(String from, String to, String relation) implements Serializable {}
