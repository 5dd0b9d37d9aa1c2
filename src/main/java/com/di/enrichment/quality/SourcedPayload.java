package com.di.enrichment.quality;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One data type's payload inside a {@link MergedPayload}, with where it came from and when it was
 * obtained.
 */
@Value
@Builder
public class SourcedPayload {

    public enum Origin {
        /** Fetched from the provider during this run. */
        FRESH,
        /** Unexpired cache entry. */
        CACHE,
        /** Expired cache entry substituted under the use_cached fallback. */
        STALE_CACHE
    }

    String dataType;
    JsonNode payload;
    Origin origin;
    /** Fetch time for fresh payloads, {@code cachedAt} for cached ones. */
    Instant obtainedAt;
    /** Confidence carried by a cached entry (already discounted for stale ones); null for fresh payloads. */
    Double confidence;
}
