package com.di.enrichment.cache;

import com.di.enrichment.exception.StoreException;
import com.di.enrichment.sql.SqlQueriesProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of {@link CacheStore} over {@code enrichment_data_cache}.
 * Active when {@code enrichment.persistence-enabled=true}. Every database failure surfaces as
 * {@link StoreException}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "enrichment.persistence-enabled", havingValue = "true")
public class JdbcCacheStore implements CacheStore {

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final RowMapper<CacheEntry> rowMapper;

    public JdbcCacheStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql, ObjectMapper objectMapper, Clock clock) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.rowMapper = (rs, rowNum) -> CacheEntry.builder()
                .dataType(rs.getString("data_type"))
                .entityId(rs.getString("entity_id"))
                .payload(readPayload(rs.getString("cached_data")))
                .confidenceScore(rs.getDouble("confidence_score"))
                .cachedAt(toInstant(rs.getTimestamp("cached_at")))
                .validUntil(toInstant(rs.getTimestamp("cache_valid_until")))
                .build();
    }

    @Override
    public Optional<CacheEntry> get(String dataType, String entityId) {
        Instant now = clock.instant();
        return getIgnoringExpiry(dataType, entityId).filter(e -> e.isValidAt(now));
    }

    @Override
    public Optional<CacheEntry> getIgnoringExpiry(String dataType, String entityId) {
        if (dataType == null || entityId == null) return Optional.empty();
        try {
            List<CacheEntry> rows = jdbc.query(sql.getCache().getFindByKey(), rowMapper, dataType, entityId);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (DataAccessException e) {
            throw new StoreException("Cache read failed for " + dataType + ":" + entityId, e);
        }
    }

    @Override
    public CacheEntry put(String dataType, String entityId, JsonNode payload, double confidenceScore, Duration ttl) {
        Instant now = clock.instant();
        CacheEntry entry = CacheEntry.builder()
                .dataType(dataType)
                .entityId(entityId)
                .payload(payload)
                .confidenceScore(confidenceScore)
                .cachedAt(now)
                .validUntil(now.plus(ttl))
                .build();
        String json = writePayload(dataType, payload);
        try {
            if (update(entry, json) == 0) {
                try {
                    jdbc.update(sql.getCache().getInsert(),
                            dataType, entityId, json, confidenceScore,
                            Timestamp.from(entry.getCachedAt()), Timestamp.from(entry.getValidUntil()));
                } catch (DuplicateKeyException race) {
                    // a concurrent run inserted the same key first; last writer wins
                    update(entry, json);
                }
            }
            log.debug("[CACHE] Stored {}:{} validUntil={}", dataType, entityId, entry.getValidUntil());
            return entry;
        } catch (DataAccessException e) {
            throw new StoreException("Cache write failed for " + dataType + ":" + entityId, e);
        }
    }

    @Override
    public CacheStatistics statistics() {
        try {
            Long total = jdbc.queryForObject(sql.getCache().getCountAll(), Long.class);
            Long expired = jdbc.queryForObject(sql.getCache().getCountExpired(), Long.class,
                    Timestamp.from(clock.instant()));
            List<CacheStatistics.DataTypeCount> byType = jdbc.query(sql.getCache().getCountByDataType(),
                    (rs, rowNum) -> new CacheStatistics.DataTypeCount(rs.getString("data_type"), rs.getLong("entry_count")));
            long t = total != null ? total : 0L;
            long x = expired != null ? expired : 0L;
            return CacheStatistics.builder()
                    .totalEntries(t)
                    .expiredEntries(x)
                    .activeEntries(t - x)
                    .byDataType(byType)
                    .build();
        } catch (DataAccessException e) {
            throw new StoreException("Cache statistics query failed", e);
        }
    }

    @Override
    public int deleteExpired() {
        try {
            return jdbc.update(sql.getCache().getDeleteExpired(), Timestamp.from(clock.instant()));
        } catch (DataAccessException e) {
            throw new StoreException("Expired cache cleanup failed", e);
        }
    }

    private int update(CacheEntry entry, String json) {
        return jdbc.update(sql.getCache().getUpdate(),
                json, entry.getConfidenceScore(),
                Timestamp.from(entry.getCachedAt()), Timestamp.from(entry.getValidUntil()),
                entry.getDataType(), entry.getEntityId());
    }

    private String writePayload(String dataType, JsonNode payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new StoreException("Cannot serialize payload for " + dataType, e);
        }
    }

    private JsonNode readPayload(String json) {
        if (json == null) return null;
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new StoreException("Corrupt cached payload", e);
        }
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
