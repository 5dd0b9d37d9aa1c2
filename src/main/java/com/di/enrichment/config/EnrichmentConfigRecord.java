package com.di.enrichment.config;

import com.di.enrichment.model.EnrichmentConfig;
import com.di.enrichment.model.EntityKind;
import com.di.enrichment.model.FallbackBehavior;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Stored default enrichment configuration for an entity kind. Several records may exist per kind;
 * the lowest {@code priorityOrder} among active ones wins.
 */
@Value
@Builder
public class EnrichmentConfigRecord {

    EntityKind entityKind;
    List<String> dataTypes;
    boolean autoEnrich;
    int priorityOrder;
    FallbackBehavior fallbackBehavior;

    public EnrichmentConfig toConfig() {
        return EnrichmentConfig.builder()
                .dataTypes(dataTypes != null ? dataTypes : List.of())
                .autoEnrich(autoEnrich)
                .priorityOrder(priorityOrder)
                .fallbackBehavior(fallbackBehavior != null ? fallbackBehavior : FallbackBehavior.SKIP)
                .build();
    }
}
