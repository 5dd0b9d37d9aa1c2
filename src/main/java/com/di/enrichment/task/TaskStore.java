package com.di.enrichment.task;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for enrichment tasks. Implementations can be in-memory or JDBC and report
 * failures as {@link com.di.enrichment.exception.StoreException}.
 */
public interface TaskStore {

    void insert(EnrichmentTask task);

    /**
     * Replaces the mutable part of a stored task (status, progress, score, summary, error, completion time).
     */
    void update(EnrichmentTask task);

    Optional<EnrichmentTask> findById(String taskId);

    /** Most recent tasks for an entity, newest first. */
    List<EnrichmentTask> findRecentByEntity(String entityId, int limit);

    long countByStatus(TaskStatus status);
}
