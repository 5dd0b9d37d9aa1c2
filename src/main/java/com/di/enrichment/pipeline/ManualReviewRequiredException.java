package com.di.enrichment.pipeline;

/**
 * A provider failed while the run's fallback behavior is {@code manual_review}. The task has been
 * marked failed, nothing was cached and no downstream process was triggered.
 */
public class ManualReviewRequiredException extends RuntimeException {

    private final String taskId;
    private final String entityId;
    private final String dataType;

    public ManualReviewRequiredException(String taskId, String entityId, String dataType, String error) {
        super(String.format("Manual review required for entity %s (task %s): %s", entityId, taskId, error));
        this.taskId = taskId;
        this.entityId = entityId;
        this.dataType = dataType;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getDataType() {
        return dataType;
    }
}
