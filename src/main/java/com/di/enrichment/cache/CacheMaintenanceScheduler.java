package com.di.enrichment.cache;

import com.di.enrichment.exception.ErrorCategory;
import com.di.enrichment.exception.StoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically removes expired cache rows ({@code enrichment.cache.cleanup-cron}).
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "enrichment.cache.cleanup-enabled", havingValue = "true", matchIfMissing = true)
public class CacheMaintenanceScheduler {

    private final CacheAdministrationService administration;

    @Scheduled(cron = "${enrichment.cache.cleanup-cron:0 0 * * * *}")
    public void purgeExpired() {
        try {
            administration.clearExpiredCache();
        } catch (StoreException e) {
            log.error("[CACHE] Scheduled cleanup failed ({}): {}", ErrorCategory.categorize(e).tag(), e.getMessage(), e);
        }
    }
}
