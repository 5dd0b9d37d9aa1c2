package com.di.enrichment.config;

import com.di.enrichment.model.DataTypes;
import com.di.enrichment.model.EntityKind;
import com.di.enrichment.model.FallbackBehavior;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Configuration records seeded from {@code enrichment.default-configs}. Used when persistence is off.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "enrichment.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryEnrichmentConfigStore implements EnrichmentConfigStore {

    private final List<EnrichmentConfigRecord> records = new CopyOnWriteArrayList<>();

    public InMemoryEnrichmentConfigStore(EnrichmentProperties properties) {
        for (EnrichmentProperties.DefaultConfig seed : properties.getDefaultConfigs()) {
            add(EnrichmentConfigRecord.builder()
                    .entityKind(EntityKind.fromCode(seed.getEntityKind()))
                    .dataTypes(seed.getDataTypes().stream()
                            .map(DataTypes::normalize)
                            .filter(Objects::nonNull)
                            .toList())
                    .autoEnrich(seed.isAutoEnrich())
                    .priorityOrder(seed.getPriorityOrder())
                    .fallbackBehavior(FallbackBehavior.fromCode(seed.getFallbackBehavior()))
                    .build());
        }
        log.info("Seeded {} enrichment config record(s)", records.size());
    }

    public void add(EnrichmentConfigRecord record) {
        records.add(record);
    }

    @Override
    public List<EnrichmentConfigRecord> findActiveByEntityKind(EntityKind entityKind) {
        return records.stream()
                .filter(r -> r.getEntityKind() == entityKind)
                .sorted(Comparator.comparingInt(EnrichmentConfigRecord::getPriorityOrder))
                .toList();
    }
}
