package com.reqflow.core.delegator;

import com.reqflow.core.model.RequirementItem;

import java.util.ArrayList;
import java.util.List;

/**
 * A slice of the run's requirements indexed as one knowledge-graph work unit.
 */
public record KgBatch(String id, List<RequirementItem> items) {

    public KgBatch {
        items = List.copyOf(items);
    }

    /**
     * Splits items into consecutive batches of at most {@code batchSize}, ids {@code kg-batch-1..n}.
     */
    public static List<KgBatch> partition(List<RequirementItem> items, int batchSize) {
        var batches = new ArrayList<KgBatch>();
        for (int from = 0; from < items.size(); from += batchSize) {
            int to = Math.min(from + batchSize, items.size());
            batches.add(new KgBatch("kg-batch-" + (batches.size() + 1), items.subList(from, to)));
        }
        return batches;
    }
}
