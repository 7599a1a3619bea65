package com.reqflow.core.model;

import java.io.Serializable;

/**
 * Raw document submitted for requirement mining.
 */
public record SourceDocument(
    String id,
    String content,
    String sourceRef
) implements Serializable {}
