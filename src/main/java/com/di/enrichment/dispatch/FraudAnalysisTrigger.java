package com.di.enrichment.dispatch;

import com.di.enrichment.model.DataTypes;
import com.di.enrichment.model.EntityKind;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Starts fraud analysis for an enriched claim and flags claims with more than one fraud indicator.
 */
@Slf4j
@Component
public class FraudAnalysisTrigger implements DownstreamTrigger {

    public static final String PRIOR_FRAUD_HISTORY = "prior_fraud_history";
    public static final String CRIMINAL_HISTORY = "criminal_history";
    public static final String POOR_CREDIT = "poor_credit";

    static final int POOR_CREDIT_THRESHOLD = 500;

    @Override
    public EntityKind entityKind() {
        return EntityKind.CLAIM;
    }

    @Override
    public void trigger(String entityId, Map<String, JsonNode> mergedPayload) {
        log.info("[DISPATCH] Triggering fraud analysis for claim={}", entityId);
        List<String> indicators = indicators(mergedPayload);
        if (indicators.size() > 1) {
            log.warn("[DISPATCH] Multiple fraud indicators detected for claim={}: {}", entityId, indicators);
        }
    }

    /**
     * Fraud indicators present in the payload, in a fixed order.
     */
    public List<String> indicators(Map<String, JsonNode> mergedPayload) {
        List<String> indicators = new ArrayList<>();
        JsonNode background = mergedPayload.get(DataTypes.BACKGROUND);
        if (background != null) {
            if (background.path("fraudHistory").asBoolean(false)) indicators.add(PRIOR_FRAUD_HISTORY);
            if (background.path("criminalRecord").asBoolean(false)) indicators.add(CRIMINAL_HISTORY);
        }
        JsonNode credit = mergedPayload.get(DataTypes.CREDIT);
        if (credit != null && credit.path("creditScore").isNumber()
                && credit.path("creditScore").asInt() < POOR_CREDIT_THRESHOLD) {
            indicators.add(POOR_CREDIT);
        }
        return indicators;
    }
}
