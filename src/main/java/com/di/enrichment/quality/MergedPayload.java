package com.di.enrichment.quality;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Payloads obtained in one run, keyed by data type in the order they were merged.
 * Only obtained data lives here; failed data types are absent.
 */
public final class MergedPayload {

    private final Map<String, SourcedPayload> entries = new LinkedHashMap<>();

    public MergedPayload put(SourcedPayload sourced) {
        entries.put(sourced.getDataType(), sourced);
        return this;
    }

    public Optional<SourcedPayload> get(String dataType) {
        return Optional.ofNullable(entries.get(dataType));
    }

    /**
     * Payload for the data type, or {@code null} when it was not obtained.
     */
    public JsonNode payload(String dataType) {
        SourcedPayload sourced = entries.get(dataType);
        return sourced != null ? sourced.getPayload() : null;
    }

    public boolean contains(String dataType) {
        return entries.containsKey(dataType);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public Collection<SourcedPayload> entries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    /**
     * Plain data type to payload view, as handed to callers and the downstream dispatcher.
     */
    public Map<String, JsonNode> asMap() {
        Map<String, JsonNode> out = new LinkedHashMap<>();
        entries.forEach((type, sourced) -> out.put(type, sourced.getPayload()));
        return Collections.unmodifiableMap(out);
    }
}
