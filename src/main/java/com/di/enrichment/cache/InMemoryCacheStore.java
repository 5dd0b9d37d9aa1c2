package com.di.enrichment.cache;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link CacheStore}. Suitable for single-node and testing.
 * When {@code enrichment.persistence-enabled=true}, {@link JdbcCacheStore} is used instead.
 */
@Component
@ConditionalOnProperty(name = "enrichment.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryCacheStore implements CacheStore {

    private final Map<Key, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCacheStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<CacheEntry> get(String dataType, String entityId) {
        Instant now = clock.instant();
        return getIgnoringExpiry(dataType, entityId).filter(e -> e.isValidAt(now));
    }

    @Override
    public Optional<CacheEntry> getIgnoringExpiry(String dataType, String entityId) {
        if (dataType == null || entityId == null) return Optional.empty();
        return Optional.ofNullable(entries.get(new Key(dataType, entityId)));
    }

    @Override
    public CacheEntry put(String dataType, String entityId, JsonNode payload, double confidenceScore, Duration ttl) {
        Instant now = clock.instant();
        CacheEntry entry = CacheEntry.builder()
                .dataType(dataType)
                .entityId(entityId)
                .payload(payload)
                .confidenceScore(confidenceScore)
                .cachedAt(now)
                .validUntil(now.plus(ttl))
                .build();
        entries.put(new Key(dataType, entityId), entry);
        return entry;
    }

    @Override
    public CacheStatistics statistics() {
        Instant now = clock.instant();
        List<CacheEntry> snapshot = List.copyOf(entries.values());
        long expired = snapshot.stream().filter(e -> !e.isValidAt(now)).count();
        Map<String, Long> byType = snapshot.stream()
                .collect(Collectors.groupingBy(CacheEntry::getDataType, TreeMap::new, Collectors.counting()));
        return CacheStatistics.builder()
                .totalEntries(snapshot.size())
                .expiredEntries(expired)
                .activeEntries(snapshot.size() - expired)
                .byDataType(byType.entrySet().stream()
                        .map(e -> new CacheStatistics.DataTypeCount(e.getKey(), e.getValue()))
                        .collect(Collectors.toList()))
                .build();
    }

    @Override
    public int deleteExpired() {
        Instant now = clock.instant();
        int[] deleted = {0};
        entries.entrySet().removeIf(e -> {
            boolean expired = !e.getValue().isValidAt(now);
            if (expired) deleted[0]++;
            return expired;
        });
        return deleted[0];
    }

    private record Key(String dataType, String entityId) {
    }
}
