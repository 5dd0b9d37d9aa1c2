package com.di.enrichment.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Per-run enrichment configuration: which data types to pursue and how to react to failures.
 */
@Value
@Builder(toBuilder = true)
public class EnrichmentConfig {

    @Singular
    List<String> dataTypes;
    @Builder.Default
    boolean autoEnrich = true;
    @Builder.Default
    int priorityOrder = 1;
    @Builder.Default
    FallbackBehavior fallbackBehavior = FallbackBehavior.SKIP;

    /** Built-in configuration used when no persisted configuration exists for an entity kind. */
    public static EnrichmentConfig defaults() {
        return EnrichmentConfig.builder()
                .dataTypes(DataTypes.ALL)
                .autoEnrich(true)
                .priorityOrder(1)
                .fallbackBehavior(FallbackBehavior.SKIP)
                .build();
    }

    public FallbackBehavior getFallbackBehavior() {
        return fallbackBehavior != null ? fallbackBehavior : FallbackBehavior.SKIP;
    }
}
