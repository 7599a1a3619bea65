package com.reqflow.core.model;

import java.io.Serializable;

/**
 * Knowledge-graph node. {@code type} is e.g. "requirement" or "term".
 */
public record GraphNode(String id, String type, String label) implements Serializable {}
