package com.di.enrichment.task;

import com.di.enrichment.model.EnrichmentConfig;
import com.di.enrichment.model.EntityKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the lifecycle of {@link EnrichmentTask}s: {@code PENDING -> IN_PROGRESS -> {COMPLETED, FAILED}}.
 *
 * <p>Every update of one task id runs under that task's lock, so progress recorded from several
 * fetch completions cannot overwrite each other. Different tasks never contend.
 */
@Slf4j
@Service
public class TaskTracker {

    private final TaskStore store;
    private final Clock clock;
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public TaskTracker(TaskStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Creates and persists a new task in {@link TaskStatus#PENDING}.
     */
    public EnrichmentTask create(String entityId, EntityKind entityKind, EnrichmentConfig config, String triggeredBy) {
        EnrichmentTask task = EnrichmentTask.builder()
                .id(UUID.randomUUID().toString())
                .entityId(entityId)
                .entityKind(entityKind)
                .taskType(config.isAutoEnrich() ? EnrichmentTask.AUTO_ENRICH : EnrichmentTask.MANUAL_ENRICH)
                .triggeredBy(triggeredBy)
                .status(TaskStatus.PENDING)
                .requestedDataTypes(List.copyOf(config.getDataTypes()))
                .completedDataTypes(List.of())
                .failedDataTypes(List.of())
                .partial(false)
                .summary(Map.of())
                .startedAt(clock.instant())
                .build();
        store.insert(task);
        log.debug("[TASK] Created task={} entity={}:{} requested={}",
                task.getId(), entityKind, entityId, task.getRequestedDataTypes());
        return task;
    }

    /**
     * {@code PENDING -> IN_PROGRESS}.
     */
    public EnrichmentTask start(String taskId) {
        return mutate(taskId, TaskStatus.IN_PROGRESS, current -> {
            if (current.getStatus() != TaskStatus.PENDING) {
                throw new TaskStateException(taskId, "already started (status " + current.getStatus() + ")");
            }
            return current.toBuilder().status(TaskStatus.IN_PROGRESS).build();
        });
    }

    /**
     * Adds data types to the completed and failed sets of a running task. Status stays
     * {@code IN_PROGRESS}. A data type outside the requested set, or one that would end up in both
     * sets, is rejected.
     */
    public EnrichmentTask recordProgress(String taskId, Collection<String> completed, Collection<String> failed) {
        return mutate(taskId, TaskStatus.IN_PROGRESS, current -> {
            Set<String> done = new LinkedHashSet<>(current.getCompletedDataTypes());
            Set<String> bad = new LinkedHashSet<>(current.getFailedDataTypes());
            if (completed != null) done.addAll(completed);
            if (failed != null) bad.addAll(failed);
            for (String type : done) {
                if (!current.getRequestedDataTypes().contains(type)) {
                    throw new TaskStateException(taskId, "data type '" + type + "' was not requested");
                }
                if (bad.contains(type)) {
                    throw new TaskStateException(taskId, "data type '" + type + "' cannot be both completed and failed");
                }
            }
            for (String type : bad) {
                if (!current.getRequestedDataTypes().contains(type)) {
                    throw new TaskStateException(taskId, "data type '" + type + "' was not requested");
                }
            }
            return current.toBuilder()
                    .completedDataTypes(List.copyOf(done))
                    .failedDataTypes(List.copyOf(bad))
                    .build();
        });
    }

    /**
     * {@code IN_PROGRESS -> COMPLETED}; sets the quality score, summary and completion time.
     */
    public EnrichmentTask complete(String taskId, double qualityScore, boolean partial, Map<String, Object> summary) {
        if (qualityScore < 0.0 || qualityScore > 100.0 || Double.isNaN(qualityScore)) {
            throw new IllegalArgumentException("Quality score out of range [0,100]: " + qualityScore);
        }
        return mutate(taskId, TaskStatus.COMPLETED, current -> current.toBuilder()
                .status(TaskStatus.COMPLETED)
                .qualityScore(qualityScore)
                .partial(partial)
                .summary(summary != null ? Map.copyOf(summary) : Map.of())
                .completedAt(clock.instant())
                .build());
    }

    /**
     * {@code IN_PROGRESS -> FAILED}; records the error and completion time.
     */
    public EnrichmentTask fail(String taskId, String errorDetail) {
        return mutate(taskId, TaskStatus.FAILED, current -> current.toBuilder()
                .status(TaskStatus.FAILED)
                .errorDetail(errorDetail != null ? errorDetail : "unknown error")
                .completedAt(clock.instant())
                .build());
    }

    public Optional<EnrichmentTask> find(String taskId) {
        return store.findById(taskId);
    }

    public List<EnrichmentTask> findRecentByEntity(String entityId, int limit) {
        return new ArrayList<>(store.findRecentByEntity(entityId, limit));
    }

    private EnrichmentTask mutate(String taskId, TaskStatus target, TaskMutation mutation) {
        Object lock = locks.computeIfAbsent(taskId, k -> new Object());
        synchronized (lock) {
            EnrichmentTask current = store.findById(taskId)
                    .orElseThrow(() -> new TaskStateException(taskId, "not found"));
            if (!current.getStatus().canTransitionTo(target)) {
                throw new TaskStateException(taskId,
                        "illegal transition " + current.getStatus() + " -> " + target);
            }
            EnrichmentTask updated = mutation.apply(current);
            store.update(updated);
            if (updated.getStatus().isTerminal()) {
                locks.remove(taskId);
                log.debug("[TASK] task={} reached {}", taskId, updated.getStatus());
            }
            return updated;
        }
    }

    @FunctionalInterface
    private interface TaskMutation {
        EnrichmentTask apply(EnrichmentTask current);
    }
}
