package com.di.enrichment.task;

import com.di.enrichment.exception.StoreException;
import com.di.enrichment.model.EntityKind;
import com.di.enrichment.sql.SqlQueriesProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of {@link TaskStore} over {@code enrichment_tasks}. Data type lists and the
 * summary are stored as JSON text. Active when {@code enrichment.persistence-enabled=true}.
 */
@Component
@ConditionalOnProperty(name = "enrichment.persistence-enabled", havingValue = "true")
public class JdbcTaskStore implements TaskStore {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> SUMMARY = new TypeReference<>() {
    };

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final ObjectMapper objectMapper;
    private final RowMapper<EnrichmentTask> rowMapper;

    public JdbcTaskStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql, ObjectMapper objectMapper) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.objectMapper = objectMapper;
        this.rowMapper = (rs, rowNum) -> {
            double score = rs.getDouble("quality_score");
            Double qualityScore = rs.wasNull() ? null : score;
            return EnrichmentTask.builder()
                    .id(rs.getString("id"))
                    .entityId(rs.getString("entity_id"))
                    .entityKind(EntityKind.fromCode(rs.getString("entity_kind")))
                    .taskType(rs.getString("task_type"))
                    .triggeredBy(rs.getString("triggered_by"))
                    .status(TaskStatus.valueOf(rs.getString("status")))
                    .requestedDataTypes(fromJson(rs.getString("requested_data_types"), STRING_LIST))
                    .completedDataTypes(fromJson(rs.getString("completed_data_types"), STRING_LIST))
                    .failedDataTypes(fromJson(rs.getString("failed_data_types"), STRING_LIST))
                    .partial(rs.getBoolean("partial_result"))
                    .qualityScore(qualityScore)
                    .summary(fromJson(rs.getString("summary"), SUMMARY))
                    .errorDetail(rs.getString("error_detail"))
                    .startedAt(toInstant(rs.getTimestamp("started_at")))
                    .completedAt(toInstant(rs.getTimestamp("completed_at")))
                    .build();
        };
    }

    @Override
    public void insert(EnrichmentTask task) {
        try {
            jdbc.update(sql.getTask().getInsert(),
                    task.getId(),
                    task.getEntityId(),
                    task.getEntityKind().getCode(),
                    task.getTaskType(),
                    task.getTriggeredBy(),
                    task.getStatus().name(),
                    toJson(task.getRequestedDataTypes()),
                    toJson(task.getCompletedDataTypes()),
                    toJson(task.getFailedDataTypes()),
                    task.isPartial(),
                    task.getQualityScore(),
                    toJson(task.getSummary()),
                    task.getErrorDetail(),
                    toTimestamp(task.getStartedAt()),
                    toTimestamp(task.getCompletedAt()));
        } catch (DataAccessException e) {
            throw new StoreException("Task insert failed for " + task.getId(), e);
        }
    }

    @Override
    public void update(EnrichmentTask task) {
        try {
            int rows = jdbc.update(sql.getTask().getUpdate(),
                    task.getStatus().name(),
                    toJson(task.getCompletedDataTypes()),
                    toJson(task.getFailedDataTypes()),
                    task.isPartial(),
                    task.getQualityScore(),
                    toJson(task.getSummary()),
                    task.getErrorDetail(),
                    toTimestamp(task.getCompletedAt()),
                    task.getId());
            if (rows == 0) {
                throw new StoreException("Task " + task.getId() + " not found for update");
            }
        } catch (DataAccessException e) {
            throw new StoreException("Task update failed for " + task.getId(), e);
        }
    }

    @Override
    public Optional<EnrichmentTask> findById(String taskId) {
        if (taskId == null || taskId.isBlank()) return Optional.empty();
        try {
            List<EnrichmentTask> rows = jdbc.query(sql.getTask().getFindById(), rowMapper, taskId);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (DataAccessException e) {
            throw new StoreException("Task read failed for " + taskId, e);
        }
    }

    @Override
    public List<EnrichmentTask> findRecentByEntity(String entityId, int limit) {
        if (limit <= 0) return List.of();
        try {
            return jdbc.query(sql.getTask().getFindRecentByEntity(), rowMapper, entityId, Math.min(limit, 500));
        } catch (DataAccessException e) {
            throw new StoreException("Task listing failed for entity " + entityId, e);
        }
    }

    @Override
    public long countByStatus(TaskStatus status) {
        try {
            Long n = jdbc.queryForObject(sql.getTask().getCountByStatus(), Long.class, status.name());
            return n != null ? n : 0L;
        } catch (DataAccessException e) {
            throw new StoreException("Task count failed for status " + status, e);
        }
    }

    private String toJson(Object value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Cannot serialize task field", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        if (json == null) return null;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Corrupt task field", e);
        }
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static Timestamp toTimestamp(Instant i) {
        return i != null ? Timestamp.from(i) : null;
    }
}
