package com.reqflow.core.capability;

import java.util.List;

/**
 * Improves a requirement in two steps: split it into atomic suggestions, then rewrite it.
 */
public interface RequirementRewriter {

    /**
     * @return atomic improvement suggestions for the text, possibly empty
     */
    List<String> suggest(String text);

    String rewrite(String text, List<String> atoms);
}
