package com.di.enrichment.provider;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Capability boundary to one external data source. Each adapter serves exactly one data type;
 * the {@link ProviderRegistry} discovers adapters as Spring beans and looks them up by
 * {@link #dataType()}.
 *
 * <p>Retries, rate limiting and credentials belong inside the adapter. The pipeline sees only the
 * opaque JSON payload or a {@link ProviderException}.
 */
public interface ProviderAdapter {

    /**
     * Data type served by this adapter (e.g. {@code driving-record}). Must be non-blank and unique
     * across registered adapters.
     */
    String dataType();

    /**
     * Fetches the payload for one entity.
     *
     * @throws ProviderException when the source fails or returns nothing usable
     */
    JsonNode fetch(String entityId) throws ProviderException;
}
