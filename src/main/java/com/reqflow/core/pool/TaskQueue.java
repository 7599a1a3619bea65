package com.reqflow.core.pool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.function.Function;

/**
 * Ordered, immutable list of work units for one phase. Ids are unique within a queue.
 */
public final class TaskQueue<T> {

    private final List<WorkUnit<T>> units;

    private TaskQueue(List<WorkUnit<T>> units) {
        this.units = Collections.unmodifiableList(units);
    }

    /**
     * Builds a queue from inputs in their given order.
     *
     * @throws IllegalArgumentException if an id is blank or appears twice
     */
    public static <T> TaskQueue<T> of(List<T> inputs, Function<T, String> idOf) {
        var units = new ArrayList<WorkUnit<T>>(inputs.size());
        var seen = new HashSet<String>();
        for (T input : inputs) {
            String id = idOf.apply(input);
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Work unit id must not be blank");
            }
            if (!seen.add(id)) {
                throw new IllegalArgumentException("Duplicate work unit id: " + id);
            }
            units.add(new WorkUnit<>(id, units.size(), input));
        }
        return new TaskQueue<>(units);
    }

    public List<WorkUnit<T>> units() {
        return units;
    }

    public int size() {
        return units.size();
    }

    public boolean isEmpty() {
        return units.isEmpty();
    }
}
