package com.di.enrichment.cache;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Snapshot of cache contents for operators.
 */
@Value
@Builder(toBuilder = true)
public class CacheStatistics {

    long totalEntries;
    long expiredEntries;
    long activeEntries;
    List<DataTypeCount> byDataType;
    /** Fraction of data type lookups served from fresh cache since startup; null when no lookups happened. */
    Double hitRate;

    @Value
    public static class DataTypeCount {
        String dataType;
        long count;
    }
}
