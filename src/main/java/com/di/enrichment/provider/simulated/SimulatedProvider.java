package com.di.enrichment.provider.simulated;

import com.di.enrichment.config.EnrichmentProperties;
import com.di.enrichment.provider.ProviderAdapter;
import com.di.enrichment.provider.ProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Base for stand-in providers. The payload is derived from a {@link Random} seeded by entity id
 * and data type, so the same entity always gets the same data. Failures are injected at
 * {@code enrichment.providers.simulated-failure-rate} and are not deterministic.
 */
public abstract class SimulatedProvider implements ProviderAdapter {

    protected final ObjectMapper objectMapper;
    private final EnrichmentProperties.Providers settings;

    protected SimulatedProvider(ObjectMapper objectMapper, EnrichmentProperties properties) {
        this.objectMapper = objectMapper;
        this.settings = properties.getProviders();
    }

    @Override
    public final JsonNode fetch(String entityId) throws ProviderException {
        simulateLatency();
        double failureRate = settings.getSimulatedFailureRate();
        if (failureRate > 0 && ThreadLocalRandom.current().nextDouble() < failureRate) {
            throw new ProviderException(dataType(), "simulated provider outage");
        }
        Random random = new Random(31L * entityId.hashCode() + dataType().hashCode());
        ObjectNode payload = objectMapper.createObjectNode();
        generate(random, payload);
        return payload;
    }

    /**
     * Fills the payload for one entity.
     */
    protected abstract void generate(Random random, ObjectNode payload);

    private void simulateLatency() throws ProviderException {
        Duration latency = settings.getSimulatedLatency();
        if (latency == null || latency.isZero() || latency.isNegative()) {
            return;
        }
        try {
            Thread.sleep(latency.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(dataType(), "interrupted", e);
        }
    }
}
