package com.di.enrichment.task;

/**
 * Thrown by {@link TaskTracker} when an update would break the task state machine
 * (skipped state, terminal task modified, data type both completed and failed).
 */
public class TaskStateException extends IllegalStateException {

    private final String taskId;

    public TaskStateException(String taskId, String message) {
        super("Task " + taskId + ": " + message);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
