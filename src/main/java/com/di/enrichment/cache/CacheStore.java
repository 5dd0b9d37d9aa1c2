package com.di.enrichment.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Durable key/value store for provider payloads, keyed by {@code (dataType, entityId)}.
 * Writes are upserts; reads of expired entries behave as absent except through
 * {@link #getIgnoringExpiry(String, String)}. Implementations can be in-memory or JDBC and
 * report failures as {@link com.di.enrichment.exception.StoreException}.
 */
public interface CacheStore {

    /**
     * Returns the entry only while it is unexpired.
     */
    Optional<CacheEntry> get(String dataType, String entityId);

    /**
     * Returns the last stored entry regardless of its expiry. Used only by the use_cached fallback.
     */
    Optional<CacheEntry> getIgnoringExpiry(String dataType, String entityId);

    /**
     * Inserts or replaces the entry for {@code (dataType, entityId)}, valid for {@code ttl} from now.
     *
     * @return the stored entry
     */
    CacheEntry put(String dataType, String entityId, JsonNode payload, double confidenceScore, Duration ttl);

    /**
     * Counts entries in total, expired, and per data type.
     */
    CacheStatistics statistics();

    /**
     * Deletes every expired entry.
     *
     * @return number of deleted entries
     */
    int deleteExpired();

    /**
     * Unexpired entries for the given data types, keyed by data type, in the order requested.
     */
    default Map<String, CacheEntry> findFresh(String entityId, Collection<String> dataTypes) {
        Map<String, CacheEntry> out = new LinkedHashMap<>();
        for (String dataType : dataTypes) {
            get(dataType, entityId).ifPresent(e -> out.put(dataType, e));
        }
        return out;
    }

    /**
     * True iff every requested data type has an unexpired entry.
     */
    default boolean isComplete(String entityId, Collection<String> dataTypes) {
        return findFresh(entityId, dataTypes).keySet().containsAll(dataTypes);
    }
}
