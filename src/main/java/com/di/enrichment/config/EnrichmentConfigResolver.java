package com.di.enrichment.config;

import com.di.enrichment.model.EnrichmentConfig;
import com.di.enrichment.model.EntityKind;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Resolves the default {@link EnrichmentConfig} for an entity kind: the active stored record with
 * the lowest priority order, else {@link EnrichmentConfig#defaults()}. Results are cached in
 * Caffeine for {@code enrichment.config-cache.expire-after-write}.
 */
@Slf4j
@Service
public class EnrichmentConfigResolver {

    private final EnrichmentConfigStore store;
    private final Cache<EntityKind, EnrichmentConfig> resolved;

    public EnrichmentConfigResolver(EnrichmentConfigStore store, EnrichmentProperties properties) {
        this.store = store;
        this.resolved = Caffeine.newBuilder()
                .maximumSize(properties.getConfigCache().getMaxSize())
                .expireAfterWrite(properties.getConfigCache().getExpireAfterWrite())
                .build();
    }

    public EnrichmentConfig resolve(EntityKind entityKind) {
        return resolved.get(entityKind, this::load);
    }

    /** Drops cached resolutions so the next call reads the store again. */
    public void invalidateAll() {
        resolved.invalidateAll();
    }

    private EnrichmentConfig load(EntityKind entityKind) {
        List<EnrichmentConfigRecord> records = store.findActiveByEntityKind(entityKind);
        if (records.isEmpty()) {
            log.debug("No stored enrichment config for {}; using built-in defaults", entityKind);
            return EnrichmentConfig.defaults();
        }
        EnrichmentConfigRecord winner = records.get(0);
        log.debug("Resolved enrichment config for {}: priority={} dataTypes={} fallback={}",
                entityKind, winner.getPriorityOrder(), winner.getDataTypes(), winner.getFallbackBehavior());
        return winner.toConfig();
    }
}
