package com.di.enrichment.cache;

import com.di.enrichment.config.EnrichmentProperties;
import com.di.enrichment.model.DataTypes;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Fixed retention window per data type, read from {@code enrichment.cache.retention}.
 */
@Component
public class CacheRetentionPolicy {

    private final Map<String, Duration> retentionByDataType;
    private final Duration defaultRetention;

    public CacheRetentionPolicy(EnrichmentProperties properties) {
        Map<String, Duration> m = new HashMap<>();
        properties.getCache().getRetention().forEach((type, ttl) -> {
            String key = DataTypes.normalize(type);
            if (key != null && ttl != null) m.put(key, ttl);
        });
        this.retentionByDataType = Collections.unmodifiableMap(m);
        this.defaultRetention = properties.getCache().getDefaultRetention();
    }

    public Duration ttlFor(String dataType) {
        Duration ttl = retentionByDataType.get(DataTypes.normalize(dataType));
        return ttl != null ? ttl : defaultRetention;
    }
}
