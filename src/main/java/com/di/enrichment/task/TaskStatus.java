package com.di.enrichment.task;

/**
 * Lifecycle of an enrichment task: {@code PENDING -> IN_PROGRESS -> {COMPLETED, FAILED}}.
 * No transition skips a state; terminal states never change.
 */
public enum TaskStatus {

    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Whether a task in this status may move to {@code next}. {@code IN_PROGRESS -> IN_PROGRESS}
     * is allowed for progress updates.
     */
    public boolean canTransitionTo(TaskStatus next) {
        if (next == null) return false;
        switch (this) {
            case PENDING:
                return next == IN_PROGRESS;
            case IN_PROGRESS:
                return next == IN_PROGRESS || next == COMPLETED || next == FAILED;
            default:
                return false;
        }
    }
}
