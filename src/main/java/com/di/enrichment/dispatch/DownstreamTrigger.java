package com.di.enrichment.dispatch;

import com.di.enrichment.model.EntityKind;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * A downstream process started for one entity kind.
 */
public interface DownstreamTrigger {

    EntityKind entityKind();

    void trigger(String entityId, Map<String, JsonNode> mergedPayload);
}
