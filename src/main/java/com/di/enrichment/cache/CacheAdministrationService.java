package com.di.enrichment.cache;

import com.di.enrichment.metrics.EnrichmentMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Operator operations on the enrichment cache.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CacheAdministrationService {

    private final CacheStore cacheStore;
    private final EnrichmentMetrics metrics;

    /**
     * Entry counts (total, expired, active, per data type) plus the hit rate of fresh lookups since
     * startup; the hit rate is null before the first lookup.
     */
    public CacheStatistics getCacheStatistics() {
        return cacheStore.statistics().toBuilder()
                .hitRate(metrics.cacheHitRate())
                .build();
    }

    /**
     * Deletes every expired entry.
     *
     * @return number of deleted entries
     */
    public int clearExpiredCache() {
        int deleted = cacheStore.deleteExpired();
        log.info("[CACHE] Cleared {} expired cache entr{}", deleted, deleted == 1 ? "y" : "ies");
        return deleted;
    }
}
