package com.di.enrichment.provider;

import com.di.enrichment.model.DataTypes;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Registry of {@link ProviderAdapter} beans keyed by normalized data type (trimmed, lower-case).
 * Two adapters for the same data type fail startup.
 */
@Slf4j
@Component
public class ProviderRegistry {

    private final List<ProviderAdapter> adapters;

    private Map<String, ProviderAdapter> adaptersByType = Collections.emptyMap();

    public ProviderRegistry(List<ProviderAdapter> adapters) {
        this.adapters = adapters != null ? adapters : List.of();
    }

    @PostConstruct
    void initialize() {
        if (adapters.isEmpty()) {
            log.warn("[PROVIDER] No ProviderAdapter beans found; every fetch will fail as unregistered.");
            adaptersByType = Collections.emptyMap();
            return;
        }
        Map<String, List<ProviderAdapter>> grouped = adapters.stream()
                .peek(ProviderRegistry::validateType)
                .collect(Collectors.groupingBy(a -> DataTypes.normalize(a.dataType())));

        String duplicates = grouped.entrySet().stream()
                .filter(e -> e.getValue().size() > 1)
                .map(e -> String.format("'%s' -> [%s]", e.getKey(), e.getValue().stream()
                        .map(a -> a.getClass().getName())
                        .collect(Collectors.joining(", "))))
                .collect(Collectors.joining(" ; "));
        if (!duplicates.isEmpty()) {
            throw new IllegalStateException("Duplicate ProviderAdapter dataType() values detected: " + duplicates);
        }

        adaptersByType = grouped.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> e.getValue().get(0)));
        adaptersByType.forEach((type, adapter) ->
                log.info("[PROVIDER] Registered {} for data type '{}'", adapter.getClass().getSimpleName(), type));
    }

    /**
     * Adapter for the data type, or empty when none is registered.
     */
    public Optional<ProviderAdapter> find(String dataType) {
        String normalized = DataTypes.normalize(dataType);
        return normalized == null ? Optional.empty() : Optional.ofNullable(adaptersByType.get(normalized));
    }

    public boolean hasProvider(String dataType) {
        return find(dataType).isPresent();
    }

    public Set<String> getRegisteredTypes() {
        return Collections.unmodifiableSet(adaptersByType.keySet());
    }

    private static void validateType(ProviderAdapter adapter) {
        if (DataTypes.normalize(adapter.dataType()) == null) {
            throw new IllegalStateException(String.format(
                    "ProviderAdapter %s returned blank dataType()", adapter.getClass().getName()));
        }
    }
}
