package com.reqflow.core.delegator;

import com.reqflow.core.model.ClarificationQuestion;
import com.reqflow.core.model.RequirementItem;

import java.util.List;

/**
 * All questions raised for one requirement, resolved as a single clarification work unit.
 */
public record ClarificationTask(RequirementItem item, List<ClarificationQuestion> questions) {

    public ClarificationTask {
        questions = List.copyOf(questions);
    }

    public String itemId() {
        return item.id();
    }
}
