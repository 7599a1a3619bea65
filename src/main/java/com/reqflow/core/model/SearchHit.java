package com.reqflow.core.model;

import java.io.Serializable;

/**
 * A search result over the knowledge graph.
 *
 * @param itemId     requirement id of the hit
 * @param text       requirement text of the hit
 * @param similarity similarity to the query in [0, 1]
 */
public record SearchHit(String itemId, String text, double similarity) implements Serializable {}
