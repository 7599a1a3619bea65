package com.reqflow.core.model;

/**
 * Priority of a clarification question. Lower rank is more urgent.
 */
public enum QuestionPriority {
    CRITICAL(1),
    HIGH(2),
    MEDIUM(3),
    LOW(4);

    private final int rank;

    QuestionPriority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }
}
