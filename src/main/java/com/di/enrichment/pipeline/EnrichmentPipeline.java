package com.di.enrichment.pipeline;

import com.di.enrichment.cache.CacheEntry;
import com.di.enrichment.cache.CacheRetentionPolicy;
import com.di.enrichment.cache.CacheStore;
import com.di.enrichment.config.EnrichmentConfigResolver;
import com.di.enrichment.config.EnrichmentProperties;
import com.di.enrichment.dispatch.DownstreamDispatcher;
import com.di.enrichment.exception.ErrorCategory;
import com.di.enrichment.exception.StoreException;
import com.di.enrichment.metrics.EnrichmentMetrics;
import com.di.enrichment.model.DataTypes;
import com.di.enrichment.model.EnrichmentConfig;
import com.di.enrichment.model.EnrichmentResult;
import com.di.enrichment.model.EntityKind;
import com.di.enrichment.model.FallbackBehavior;
import com.di.enrichment.provider.ProviderAdapter;
import com.di.enrichment.provider.ProviderException;
import com.di.enrichment.provider.ProviderRegistry;
import com.di.enrichment.quality.MergedPayload;
import com.di.enrichment.quality.QualityReport;
import com.di.enrichment.quality.QualityScorer;
import com.di.enrichment.quality.SourcedPayload;
import com.di.enrichment.task.EnrichmentTask;
import com.di.enrichment.task.TaskTracker;
import com.di.enrichment.util.MdcPropagation;
import com.di.enrichment.validation.CrossSourceValidator;
import com.di.enrichment.validation.ValidationNotice;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one enrichment of a policy or claim.
 *
 * <h3>Flow</h3>
 * <ol>
 *   <li>Create the task and move it to {@code IN_PROGRESS}.</li>
 *   <li>Serve every data type with an unexpired cache entry from the cache. When all are served,
 *       no provider is called and the score is the mean cached confidence.</li>
 *   <li>Fetch the remaining data types in parallel, one worker per data type, each bounded by
 *       {@code enrichment.provider.timeout}. Outcomes are consumed as they complete on the calling
 *       thread, which applies the fallback behavior and records task progress.</li>
 *   <li>Validate across sources, score, cache the freshly fetched payloads, complete the task and
 *       hand the merged payload to the {@link DownstreamDispatcher}.</li>
 * </ol>
 *
 * <h3>Errors</h3>
 * Provider failures never escape except under {@code manual_review}, which fails the task and throws
 * {@link ManualReviewRequiredException} before anything is cached or dispatched. A
 * {@link StoreException} fails the task (best effort) and is rethrown. Dispatcher failures are logged.
 */
@Slf4j
@Service
public class EnrichmentPipeline {

    public static final String DEFAULT_TRIGGERED_BY = "system";

    private final CacheStore cacheStore;
    private final CacheRetentionPolicy retentionPolicy;
    private final ProviderRegistry providerRegistry;
    private final CrossSourceValidator validator;
    private final QualityScorer qualityScorer;
    private final TaskTracker taskTracker;
    private final DownstreamDispatcher dispatcher;
    private final EnrichmentConfigResolver configResolver;
    private final EnrichmentMetrics metrics;
    private final EnrichmentProperties properties;
    private final Clock clock;

    public EnrichmentPipeline(CacheStore cacheStore,
                              CacheRetentionPolicy retentionPolicy,
                              ProviderRegistry providerRegistry,
                              CrossSourceValidator validator,
                              QualityScorer qualityScorer,
                              TaskTracker taskTracker,
                              DownstreamDispatcher dispatcher,
                              EnrichmentConfigResolver configResolver,
                              EnrichmentMetrics metrics,
                              EnrichmentProperties properties,
                              Clock clock) {
        this.cacheStore = cacheStore;
        this.retentionPolicy = retentionPolicy;
        this.providerRegistry = providerRegistry;
        this.validator = validator;
        this.qualityScorer = qualityScorer;
        this.taskTracker = taskTracker;
        this.dispatcher = dispatcher;
        this.configResolver = configResolver;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    public EnrichmentResult enrichPolicy(String policyId) {
        return enrich(policyId, EntityKind.POLICY, null);
    }

    public EnrichmentResult enrichPolicy(String policyId, EnrichmentConfig config) {
        return enrich(policyId, EntityKind.POLICY, config);
    }

    public EnrichmentResult enrichClaim(String claimId) {
        return enrich(claimId, EntityKind.CLAIM, null);
    }

    public EnrichmentResult enrichClaim(String claimId, EnrichmentConfig config) {
        return enrich(claimId, EntityKind.CLAIM, config);
    }

    public EnrichmentResult enrich(String entityId, EntityKind entityKind, EnrichmentConfig config) {
        return enrich(entityId, entityKind, config, DEFAULT_TRIGGERED_BY);
    }

    /**
     * Enriches one entity.
     *
     * @param config per-run configuration; null resolves the stored default for the entity kind, and a
     *               config without data types takes the default's data types
     * @throws IllegalArgumentException     when the id or kind is missing or no data type is left to enrich
     * @throws ManualReviewRequiredException when a provider fails under {@code manual_review}
     * @throws StoreException               when the cache or task store fails
     */
    public EnrichmentResult enrich(String entityId, EntityKind entityKind, EnrichmentConfig config, String triggeredBy) {
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("Entity id cannot be null or blank");
        }
        if (entityKind == null) {
            throw new IllegalArgumentException("Entity kind cannot be null");
        }
        EnrichmentConfig effective = effectiveConfig(entityKind, withDefaults(entityKind, config));
        if (effective.getDataTypes().isEmpty()) {
            throw new IllegalArgumentException("No data types to enrich for " + entityKind + " " + entityId);
        }

        long startNanos = System.nanoTime();
        MDC.put(MdcPropagation.ENTITY_ID, entityId);
        MDC.put(MdcPropagation.ENTITY_KIND, entityKind.getCode());
        try {
            EnrichmentTask task = taskTracker.create(entityId, entityKind, effective,
                    triggeredBy != null ? triggeredBy : DEFAULT_TRIGGERED_BY);
            MDC.put(MdcPropagation.TASK_ID, task.getId());
            log.info("[PIPELINE] Enrichment started: {} {} dataTypes={} fallback={}",
                    entityKind, entityId, effective.getDataTypes(), effective.getFallbackBehavior().getCode());
            try {
                EnrichmentResult result = run(task, effective);
                metrics.recordRun(result.isPartial() ? "partial" : "completed", elapsedMs(startNanos));
                return result;
            } catch (ManualReviewRequiredException e) {
                metrics.recordRun("manual_review", elapsedMs(startNanos));
                throw e;
            } catch (StoreException e) {
                metrics.recordRun("failed", elapsedMs(startNanos));
                failQuietly(task.getId(), "store failure: " + e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                metrics.recordRun("failed", elapsedMs(startNanos));
                failQuietly(task.getId(), "unexpected failure: " + e.getMessage());
                throw e;
            }
        } finally {
            MDC.remove(MdcPropagation.TASK_ID);
            MDC.remove(MdcPropagation.ENTITY_ID);
            MDC.remove(MdcPropagation.ENTITY_KIND);
        }
    }

    public Optional<EnrichmentTask> getTask(String taskId) {
        return taskTracker.find(taskId);
    }

    /**
     * Most recent tasks for an entity, newest first.
     */
    public List<EnrichmentTask> getRecentTasks(String entityId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return taskTracker.findRecentByEntity(entityId, limit);
    }

    /**
     * Null config resolves the stored default; a config without data types takes the default's data
     * types and keeps its own fallback behavior and auto-enrich flag.
     */
    private EnrichmentConfig withDefaults(EntityKind entityKind, EnrichmentConfig config) {
        if (config == null) {
            return configResolver.resolve(entityKind);
        }
        if (config.getDataTypes() == null || config.getDataTypes().isEmpty()) {
            return config.toBuilder()
                    .clearDataTypes()
                    .dataTypes(configResolver.resolve(entityKind).getDataTypes())
                    .build();
        }
        return config;
    }

    /**
     * Normalizes, de-duplicates (first occurrence wins) and, for claims, drops the driving record.
     */
    static EnrichmentConfig effectiveConfig(EntityKind entityKind, EnrichmentConfig config) {
        Set<String> dataTypes = new LinkedHashSet<>();
        for (String dataType : config.getDataTypes()) {
            String normalized = DataTypes.normalize(dataType);
            if (normalized == null) continue;
            if (entityKind == EntityKind.CLAIM && DataTypes.DRIVING_RECORD.equals(normalized)) continue;
            dataTypes.add(normalized);
        }
        return config.toBuilder()
                .clearDataTypes()
                .dataTypes(dataTypes)
                .build();
    }

    private EnrichmentResult run(EnrichmentTask task, EnrichmentConfig config) {
        String taskId = task.getId();
        String entityId = task.getEntityId();
        List<String> requested = config.getDataTypes();

        taskTracker.start(taskId);

        Map<String, CacheEntry> fresh = cacheStore.findFresh(entityId, requested);
        List<String> toFetch = requested.stream().filter(t -> !fresh.containsKey(t)).toList();
        metrics.recordCacheLookups(fresh.size(), toFetch.size());

        Map<String, SourcedPayload> obtained = new LinkedHashMap<>();
        fresh.forEach((type, entry) -> {
            obtained.put(type, SourcedPayload.builder()
                    .dataType(type)
                    .payload(entry.getPayload())
                    .origin(SourcedPayload.Origin.CACHE)
                    .obtainedAt(entry.getCachedAt())
                    .confidence(entry.getConfidenceScore())
                    .build());
        });
        if (!fresh.isEmpty()) {
            taskTracker.recordProgress(taskId, fresh.keySet(), List.of());
            log.info("[CACHE] {} of {} data type(s) served from cache: {}", fresh.size(), requested.size(), fresh.keySet());
        }

        List<String> errors = new ArrayList<>();
        Set<String> failed = new LinkedHashSet<>();
        Set<String> stale = new LinkedHashSet<>();
        if (!toFetch.isEmpty()) {
            fetchAndCollect(task, config, toFetch, obtained, errors, failed, stale);
        }

        MergedPayload merged = new MergedPayload();
        for (String type : requested) {
            SourcedPayload sourced = obtained.get(type);
            if (sourced != null) merged.put(sourced);
        }
        List<ValidationNotice> notices = validator.validate(merged);
        notices.forEach(n -> log.warn("[PIPELINE] Validation notice {}: {}", n.getCode(), n.getMessage()));

        double score;
        if (toFetch.isEmpty()) {
            score = fresh.values().stream().mapToDouble(CacheEntry::getConfidenceScore).average().orElse(0.0);
            score = Math.max(0.0, Math.min(100.0, score));
        } else {
            QualityReport report = qualityScorer.score(merged);
            score = report.getScore();
            log.debug("[PIPELINE] Quality completeness={} accuracy={} freshness={} consistency={} score={}",
                    report.getCompleteness(), report.getAccuracy(), report.getFreshness(), report.getConsistency(), score);
        }
        metrics.recordQualityScore(score);

        List<String> fetched = new ArrayList<>();
        for (SourcedPayload sourced : merged.entries()) {
            if (sourced.getOrigin() != SourcedPayload.Origin.FRESH) continue;
            String type = sourced.getDataType();
            cacheStore.put(type, entityId, sourced.getPayload(), score, retentionPolicy.ttlFor(type));
            fetched.add(type);
        }
        if (!fetched.isEmpty()) {
            log.debug("[CACHE] Cached {} fresh payload(s) for {}: {}", fetched.size(), entityId, fetched);
        }

        boolean partial = !errors.isEmpty();
        taskTracker.complete(taskId, score, partial,
                summary(merged, fresh.keySet(), stale, failed, notices, errors, score));

        Map<String, JsonNode> data = merged.asMap();
        try {
            dispatcher.dispatch(entityId, task.getEntityKind(), data);
        } catch (RuntimeException e) {
            log.error("[DISPATCH] Downstream dispatch failed for {} {}: {}",
                    task.getEntityKind(), entityId, e.getMessage(), e);
        }

        Map<String, Double> orderedConfidence = new LinkedHashMap<>();
        for (SourcedPayload sourced : merged.entries()) {
            orderedConfidence.put(sourced.getDataType(),
                    sourced.getOrigin() == SourcedPayload.Origin.FRESH ? score : sourced.getConfidence());
        }
        EnrichmentResult result = EnrichmentResult.builder()
                .taskId(taskId)
                .entityId(entityId)
                .entityKind(task.getEntityKind())
                .status(partial ? EnrichmentResult.Status.PARTIAL : EnrichmentResult.Status.COMPLETED)
                .data(data)
                .errors(List.copyOf(errors))
                .validationNotices(List.copyOf(notices))
                .qualityScore(score)
                .completedDataTypes(Collections.unmodifiableSet(new LinkedHashSet<>(data.keySet())))
                .failedDataTypes(Collections.unmodifiableSet(failed))
                .cachedDataTypes(Collections.unmodifiableSet(new LinkedHashSet<>(fresh.keySet())))
                .staleDataTypes(Collections.unmodifiableSet(stale))
                .confidenceByDataType(Collections.unmodifiableMap(orderedConfidence))
                .build();
        log.info("[PIPELINE] Enrichment {}: {} {} score={} completed={} failed={} errors={}",
                result.getStatus(), task.getEntityKind(), entityId, String.format("%.1f", score),
                result.getCompletedDataTypes(), failed, errors.size());
        return result;
    }

    /**
     * Fans out one fetch per data type and consumes the outcomes as they complete.
     */
    private void fetchAndCollect(EnrichmentTask task, EnrichmentConfig config, List<String> toFetch,
                                 Map<String, SourcedPayload> obtained,
                                 List<String> errors, Set<String> failed, Set<String> stale) {
        String taskId = task.getId();
        Duration timeout = properties.getProvider().getTimeout();
        BlockingQueue<FetchOutcome> outcomes = new LinkedBlockingQueue<>();
        ExecutorService executor = Executors.newFixedThreadPool(toFetch.size(), fetchThreadFactory(taskId));
        try {
            for (String type : toFetch) {
                CompletableFuture
                        .supplyAsync(MdcPropagation.wrapSupplier(() -> fetchOne(type, task.getEntityId())), executor)
                        .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                        .handle((payload, ex) -> ex == null
                                ? FetchOutcome.success(type, payload, clock.instant())
                                : failureOutcome(type, ex, timeout))
                        .thenAccept(outcomes::add);
            }

            for (int received = 0; received < toFetch.size(); received++) {
                FetchOutcome outcome = outcomes.take();
                String type = outcome.dataType();
                if (outcome.isSuccess()) {
                    obtained.put(type, SourcedPayload.builder()
                            .dataType(type)
                            .payload(outcome.payload())
                            .origin(SourcedPayload.Origin.FRESH)
                            .obtainedAt(outcome.completedAt())
                            .build());
                    taskTracker.recordProgress(taskId, List.of(type), List.of());
                    continue;
                }

                ErrorCategory category = ErrorCategory.categorize(outcome.cause());
                metrics.recordProviderFailure(type, category);
                String error = type + ": " + outcome.error();
                log.warn("[PROVIDER] {} failed ({}): {}", type, category.tag(), outcome.error());

                FallbackBehavior fallback = config.getFallbackBehavior();
                if (fallback == FallbackBehavior.MANUAL_REVIEW) {
                    taskTracker.fail(taskId, error);
                    log.warn("[PIPELINE] Aborting for manual review: {}", error);
                    throw new ManualReviewRequiredException(taskId, task.getEntityId(), type, error);
                }
                errors.add(error);
                if (fallback == FallbackBehavior.USE_CACHED && useStale(task.getEntityId(), type, obtained)) {
                    stale.add(type);
                    taskTracker.recordProgress(taskId, List.of(type), List.of());
                } else {
                    failed.add(type);
                    taskTracker.recordProgress(taskId, List.of(), List.of(type));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failQuietly(taskId, "interrupted while waiting for providers");
            throw new IllegalStateException("Enrichment interrupted for task " + taskId, e);
        } finally {
            executor.shutdown();
        }
    }

    private JsonNode fetchOne(String dataType, String entityId) {
        long start = System.nanoTime();
        try {
            ProviderAdapter adapter = providerRegistry.find(dataType)
                    .orElseThrow(() -> new ProviderException(dataType, "no provider adapter registered"));
            JsonNode payload = adapter.fetch(entityId);
            if (payload == null || payload.isNull() || payload.isMissingNode()) {
                throw new ProviderException(dataType, "provider returned no data");
            }
            log.debug("[PROVIDER] {} fetched in {}ms", dataType, elapsedMs(start));
            return payload;
        } catch (ProviderException e) {
            throw new CompletionException(e);
        } finally {
            metrics.recordProviderFetch(dataType, elapsedMs(start));
        }
    }

    private FetchOutcome failureOutcome(String dataType, Throwable ex, Duration timeout) {
        Throwable cause = ex;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        String message;
        if (cause instanceof TimeoutException) {
            message = "timed out after " + timeout.toMillis() + "ms";
        } else if (cause.getMessage() != null && !cause.getMessage().isBlank()) {
            message = cause.getMessage();
        } else {
            message = cause.getClass().getSimpleName();
        }
        return FetchOutcome.failure(dataType, message, cause, clock.instant());
    }

    /**
     * use_cached: substitutes the last stored entry regardless of expiry, with discounted confidence.
     */
    private boolean useStale(String entityId, String dataType, Map<String, SourcedPayload> obtained) {
        Optional<CacheEntry> entry = cacheStore.getIgnoringExpiry(dataType, entityId);
        if (entry.isEmpty()) {
            log.info("[CACHE] No stale entry for {}; treating as skipped", dataType);
            return false;
        }
        double discounted = entry.get().getConfidenceScore() * properties.getFallback().getStaleConfidenceFactor();
        obtained.put(dataType, SourcedPayload.builder()
                .dataType(dataType)
                .payload(entry.get().getPayload())
                .origin(SourcedPayload.Origin.STALE_CACHE)
                .obtainedAt(entry.get().getCachedAt())
                .confidence(discounted)
                .build());
        log.info("[CACHE] Using stale {} cached at {} (confidence {})", dataType, entry.get().getCachedAt(), discounted);
        return true;
    }

    private static Map<String, Object> summary(MergedPayload merged, Set<String> cacheHits, Set<String> stale,
                                               Set<String> failed, List<ValidationNotice> notices,
                                               List<String> errors, double score) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("dataTypesEnriched", List.copyOf(merged.asMap().keySet()));
        summary.put("cacheHits", List.copyOf(cacheHits));
        summary.put("staleDataTypes", List.copyOf(stale));
        summary.put("failedDataTypes", List.copyOf(failed));
        summary.put("validationNotices", notices.stream().map(ValidationNotice::getCode).toList());
        summary.put("errorCount", errors.size());
        summary.put("qualityScore", score);
        return summary;
    }

    private void failQuietly(String taskId, String error) {
        try {
            if (taskTracker.find(taskId).map(t -> t.getStatus().isTerminal()).orElse(false)) {
                return;
            }
            taskTracker.fail(taskId, error);
        } catch (RuntimeException e) {
            log.error("[TASK] Could not mark task {} failed after '{}': {}", taskId, error, e.getMessage());
        }
    }

    private static ThreadFactory fetchThreadFactory(String taskId) {
        AtomicInteger counter = new AtomicInteger();
        String prefix = "enrich-fetch-" + taskId.substring(0, Math.min(8, taskId.length())) + "-";
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
