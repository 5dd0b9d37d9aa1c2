package com.di.enrichment.dispatch;

import com.di.enrichment.model.EntityKind;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Starts underwriting evaluation for an enriched policy. The rule engine itself lives elsewhere;
 * this is the hand-off point.
 */
@Slf4j
@Component
public class UnderwritingEvaluationTrigger implements DownstreamTrigger {

    @Override
    public EntityKind entityKind() {
        return EntityKind.POLICY;
    }

    @Override
    public void trigger(String entityId, Map<String, JsonNode> mergedPayload) {
        log.info("[DISPATCH] Triggering underwriting evaluation for policy={} dataTypes={}",
                entityId, mergedPayload.keySet());
    }
}
