package com.di.enrichment.task;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link TaskStore}. Suitable for single-node and testing.
 * When {@code enrichment.persistence-enabled=true}, {@link JdbcTaskStore} is used instead.
 */
@Component
@ConditionalOnProperty(name = "enrichment.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryTaskStore implements TaskStore {

    private final Map<String, EnrichmentTask> byId = new ConcurrentHashMap<>();

    @Override
    public void insert(EnrichmentTask task) {
        if (task == null || task.getId() == null) return;
        byId.put(task.getId(), task);
    }

    @Override
    public void update(EnrichmentTask task) {
        if (task == null || task.getId() == null) return;
        byId.computeIfPresent(task.getId(), (id, existing) -> task);
    }

    @Override
    public Optional<EnrichmentTask> findById(String taskId) {
        if (taskId == null) return Optional.empty();
        return Optional.ofNullable(byId.get(taskId));
    }

    @Override
    public List<EnrichmentTask> findRecentByEntity(String entityId, int limit) {
        if (limit <= 0) return List.of();
        return byId.values().stream()
                .filter(t -> t.getEntityId().equals(entityId))
                .sorted(Comparator.comparing(EnrichmentTask::getStartedAt).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public long countByStatus(TaskStatus status) {
        return byId.values().stream().filter(t -> t.getStatus() == status).count();
    }
}
