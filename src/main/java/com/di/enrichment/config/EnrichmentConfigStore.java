package com.di.enrichment.config;

import com.di.enrichment.model.EntityKind;

import java.util.List;

/**
 * Source of stored default configurations.
 */
public interface EnrichmentConfigStore {

    /**
     * Active records for the entity kind, ordered by ascending {@code priorityOrder}.
     */
    List<EnrichmentConfigRecord> findActiveByEntityKind(EntityKind entityKind);
}
