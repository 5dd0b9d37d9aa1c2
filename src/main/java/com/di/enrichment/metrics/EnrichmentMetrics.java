package com.di.enrichment.metrics;

import com.di.enrichment.exception.ErrorCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for enrichment runs, cache lookups and provider fetches.
 */
@Slf4j
@Component
public class EnrichmentMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final DistributionSummary qualityScoreDistribution;

    public EnrichmentMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.cacheHitCounter = Counter.builder("enrichment.cache.lookups")
                .description("Fresh cache lookups per data type")
                .tag("result", "hit")
                .register(meterRegistry);

        this.cacheMissCounter = Counter.builder("enrichment.cache.lookups")
                .description("Fresh cache lookups per data type")
                .tag("result", "miss")
                .register(meterRegistry);

        this.qualityScoreDistribution = DistributionSummary.builder("enrichment.quality.score")
                .description("Distribution of composite quality scores")
                .register(meterRegistry);
    }

    // ============================================================================
    // Runs
    // ============================================================================

    /**
     * Records the end of a run.
     *
     * @param outcome completed, partial, manual_review or failed
     */
    public void recordRun(String outcome, long durationMs) {
        Counter.builder("enrichment.runs.total")
                .description("Enrichment runs by outcome")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
        Timer.builder("enrichment.runs.duration")
                .description("Wall time of one enrichment run")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        log.debug("Recorded run: outcome={}, durationMs={}", outcome, durationMs);
    }

    public void recordQualityScore(double score) {
        qualityScoreDistribution.record(score);
    }

    // ============================================================================
    // Cache
    // ============================================================================

    public void recordCacheLookups(int hits, int misses) {
        if (hits > 0) cacheHitCounter.increment(hits);
        if (misses > 0) cacheMissCounter.increment(misses);
    }

    /**
     * Share of fresh cache lookups that hit since startup, or null before the first lookup.
     */
    public Double cacheHitRate() {
        double hits = cacheHitCounter.count();
        double total = hits + cacheMissCounter.count();
        return total == 0 ? null : hits / total;
    }

    // ============================================================================
    // Providers
    // ============================================================================

    public void recordProviderFetch(String dataType, long durationMs) {
        Timer.builder("enrichment.provider.fetch.duration")
                .description("Provider fetch latency")
                .tag("dataType", dataType)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordProviderFailure(String dataType, ErrorCategory category) {
        Counter.builder("enrichment.provider.failures")
                .description("Provider fetch failures")
                .tag("dataType", dataType)
                .tag("category", category.tag())
                .register(meterRegistry)
                .increment();
    }
}
