package com.reqflow.core.capability;

import com.reqflow.core.model.RequirementItem;
import com.reqflow.core.model.SourceDocument;

import java.util.List;

/**
 * Extracts requirement statements from a raw document.
 */
public interface RequirementMiner {

    List<RequirementItem> mine(SourceDocument document);
}
