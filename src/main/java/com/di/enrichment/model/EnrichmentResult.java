package com.di.enrichment.model;

import com.di.enrichment.validation.ValidationNotice;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of one enrichment run. Not persisted as such: the task record carries the lifecycle,
 * the cache carries the payloads.
 */
@Value
@Builder
public class EnrichmentResult {

    public enum Status {
        /** Every requested data type was obtained and no provider error occurred. */
        COMPLETED,
        /** At least one provider error was recovered under skip or use_cached. */
        PARTIAL
    }

    String taskId;
    String entityId;
    EntityKind entityKind;
    Status status;
    /** Merged payloads keyed by data type (cache hits, stale substitutions and fresh fetches). */
    Map<String, JsonNode> data;
    List<String> errors;
    List<ValidationNotice> validationNotices;
    double qualityScore;
    Set<String> completedDataTypes;
    Set<String> failedDataTypes;
    /** Data types served from an unexpired cache entry. */
    Set<String> cachedDataTypes;
    /** Data types served from an expired cache entry under use_cached fallback. */
    Set<String> staleDataTypes;
    Map<String, Double> confidenceByDataType;

    public boolean isPartial() {
        return status == Status.PARTIAL;
    }
}
