package com.di.enrichment.config;

import com.di.enrichment.exception.StoreException;
import com.di.enrichment.model.DataTypes;
import com.di.enrichment.model.EntityKind;
import com.di.enrichment.model.FallbackBehavior;
import com.di.enrichment.sql.SqlQueriesProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Reads {@code data_enrichment_config}. Data types are stored comma-separated.
 */
@Component
@ConditionalOnProperty(name = "enrichment.persistence-enabled", havingValue = "true")
public class JdbcEnrichmentConfigStore implements EnrichmentConfigStore {

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;

    public JdbcEnrichmentConfigStore(JdbcTemplate jdbc, SqlQueriesProperties sql) {
        this.jdbc = jdbc;
        this.sql = sql;
    }

    @Override
    public List<EnrichmentConfigRecord> findActiveByEntityKind(EntityKind entityKind) {
        try {
            return jdbc.query(sql.getConfig().getFindByEntityKind(), (rs, rowNum) -> EnrichmentConfigRecord.builder()
                    .entityKind(EntityKind.fromCode(rs.getString("entity_kind")))
                    .dataTypes(splitDataTypes(rs.getString("data_types")))
                    .autoEnrich(rs.getBoolean("auto_enrich"))
                    .priorityOrder(rs.getInt("priority_order"))
                    .fallbackBehavior(FallbackBehavior.fromCode(rs.getString("fallback_behavior")))
                    .build(), entityKind.getCode());
        } catch (DataAccessException e) {
            throw new StoreException("Failed to load enrichment config for " + entityKind, e);
        }
    }

    static List<String> splitDataTypes(String joined) {
        if (joined == null || joined.isBlank()) return List.of();
        return Arrays.stream(joined.split(","))
                .map(DataTypes::normalize)
                .filter(Objects::nonNull)
                .toList();
    }
}
