package com.di.enrichment.task;

import com.di.enrichment.model.EntityKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persisted record of one enrichment run. Immutable; {@link TaskTracker} produces updated copies.
 */
@Value
@Builder(toBuilder = true)
public class EnrichmentTask {

    public static final String AUTO_ENRICH = "auto_enrich";
    public static final String MANUAL_ENRICH = "manual_enrich";

    String id;
    String entityId;
    EntityKind entityKind;
    /** {@link #AUTO_ENRICH} or {@link #MANUAL_ENRICH}. */
    String taskType;
    String triggeredBy;
    TaskStatus status;
    List<String> requestedDataTypes;
    List<String> completedDataTypes;
    List<String> failedDataTypes;
    /** True when the run completed with recovered provider errors. */
    boolean partial;
    /** Null until the task completes. */
    Double qualityScore;
    Map<String, Object> summary;
    /** Set only when the task failed. */
    String errorDetail;
    Instant startedAt;
    Instant completedAt;
}
