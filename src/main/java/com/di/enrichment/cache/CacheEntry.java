package com.di.enrichment.cache;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One cached provider payload, keyed by {@code (dataType, entityId)}.
 */
@Value
@Builder(toBuilder = true)
public class CacheEntry {

    String dataType;
    String entityId;
    JsonNode payload;
    /** Quality score (0-100) of the run that produced the payload. */
    double confidenceScore;
    Instant cachedAt;
    Instant validUntil;

    /** An entry is usable as fresh only strictly before its expiry. */
    public boolean isValidAt(Instant now) {
        return validUntil != null && now.isBefore(validUntil);
    }
}
