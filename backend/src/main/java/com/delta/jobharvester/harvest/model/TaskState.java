package com.delta.jobharvester.harvest.model;

import java.util.Locale;

public enum TaskState {
    PENDING(0),
    SUBMITTED(1),
    PROCESSING(2),
    RETRIEVED(3),
    PROCESSED(4),
    FAILED(4);

    private final int rank;

    TaskState(int rank) {
        this.rank = rank;
    }

    public boolean isTerminal() {
        return this == PROCESSED || this == FAILED;
    }

    /**
     * Transitions only move forward; any non-terminal state may fail.
     */
    public boolean canTransitionTo(TaskState next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return next.rank > rank;
    }

    public static TaskState parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return TaskState.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
