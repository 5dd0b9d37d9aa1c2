package com.di.enrichment.dispatch;

import com.di.enrichment.model.EntityKind;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Hands the merged payload of a finished run to downstream decision processes.
 * Implementations should not block the run; the pipeline logs and swallows anything they throw.
 */
public interface DownstreamDispatcher {

    void dispatch(String entityId, EntityKind entityKind, Map<String, JsonNode> mergedPayload);
}
