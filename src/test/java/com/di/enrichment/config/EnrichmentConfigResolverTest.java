package com.di.enrichment.config;

import com.di.enrichment.model.DataTypes;
import com.di.enrichment.model.EnrichmentConfig;
import com.di.enrichment.model.EntityKind;
import com.di.enrichment.model.FallbackBehavior;
import com.di.enrichment.support.SqlQueriesFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EnrichmentConfigResolver Tests")
class EnrichmentConfigResolverTest {

    private static EnrichmentProperties.DefaultConfig seed(String kind, List<String> types, int priority, String fallback) {
        EnrichmentProperties.DefaultConfig config = new EnrichmentProperties.DefaultConfig();
        config.setEntityKind(kind);
        config.setDataTypes(new ArrayList<>(types));
        config.setPriorityOrder(priority);
        config.setFallbackBehavior(fallback);
        return config;
    }

    @Test
    @DisplayName("Without stored records the built-in default is used")
    void testBuiltInDefault() {
        EnrichmentProperties properties = new EnrichmentProperties();
        EnrichmentConfigResolver resolver = new EnrichmentConfigResolver(new InMemoryEnrichmentConfigStore(properties), properties);

        EnrichmentConfig config = resolver.resolve(EntityKind.POLICY);
        assertEquals(DataTypes.ALL, config.getDataTypes());
        assertTrue(config.isAutoEnrich());
        assertEquals(1, config.getPriorityOrder());
        assertEquals(FallbackBehavior.SKIP, config.getFallbackBehavior());
    }

    @Test
    @DisplayName("Lowest priority order wins among stored records for the kind")
    void testPriorityOrder() {
        EnrichmentProperties properties = new EnrichmentProperties();
        properties.getDefaultConfigs().add(seed("claim", List.of("credit"), 5, "skip"));
        properties.getDefaultConfigs().add(seed("claim", List.of("Background", "credit"), 2, "use_cached"));
        properties.getDefaultConfigs().add(seed("policy", List.of("credit"), 1, "manual_review"));
        EnrichmentConfigResolver resolver = new EnrichmentConfigResolver(new InMemoryEnrichmentConfigStore(properties), properties);

        EnrichmentConfig claim = resolver.resolve(EntityKind.CLAIM);
        assertEquals(List.of(DataTypes.BACKGROUND, DataTypes.CREDIT), claim.getDataTypes());
        assertEquals(FallbackBehavior.USE_CACHED, claim.getFallbackBehavior());
        assertEquals(2, claim.getPriorityOrder());
        assertEquals(FallbackBehavior.MANUAL_REVIEW, resolver.resolve(EntityKind.POLICY).getFallbackBehavior());
    }

    @Test
    @DisplayName("Resolutions are cached until invalidated")
    void testCaching() {
        AtomicInteger loads = new AtomicInteger();
        EnrichmentConfigStore counting = kind -> {
            loads.incrementAndGet();
            return List.of();
        };
        EnrichmentConfigResolver resolver = new EnrichmentConfigResolver(counting, new EnrichmentProperties());

        resolver.resolve(EntityKind.POLICY);
        resolver.resolve(EntityKind.POLICY);
        assertEquals(1, loads.get());

        resolver.invalidateAll();
        resolver.resolve(EntityKind.POLICY);
        assertEquals(2, loads.get());
    }

    @Test
    @DisplayName("JDBC store reads active records ordered by priority")
    void testJdbcStore() {
        JdbcTemplate jdbc = new JdbcTemplate(SqlQueriesFixture.h2WithSchema());
        String insert = "INSERT INTO data_enrichment_config "
                + "(id, entity_kind, data_types, auto_enrich, priority_order, fallback_behavior, active) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?)";
        jdbc.update(insert, "c1", "policy", "credit,background", true, 3, "skip", true);
        jdbc.update(insert, "c2", "policy", "driving-record, prior-claims", false, 1, "manual_review", true);
        jdbc.update(insert, "c3", "policy", "credit", true, 0, "skip", false);
        jdbc.update(insert, "c4", "claim", "credit", true, 0, "skip", true);

        JdbcEnrichmentConfigStore store = new JdbcEnrichmentConfigStore(jdbc, SqlQueriesFixture.sqlQueries());
        List<EnrichmentConfigRecord> records = store.findActiveByEntityKind(EntityKind.POLICY);
        assertEquals(2, records.size());
        assertEquals(1, records.get(0).getPriorityOrder());
        assertEquals(List.of(DataTypes.DRIVING_RECORD, DataTypes.PRIOR_CLAIMS), records.get(0).getDataTypes());
        assertFalse(records.get(0).isAutoEnrich());

        EnrichmentConfigResolver resolver = new EnrichmentConfigResolver(store, new EnrichmentProperties());
        assertEquals(FallbackBehavior.MANUAL_REVIEW, resolver.resolve(EntityKind.POLICY).getFallbackBehavior());
    }
}
