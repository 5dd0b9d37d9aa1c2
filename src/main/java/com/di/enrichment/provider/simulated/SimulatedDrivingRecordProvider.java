package com.di.enrichment.provider.simulated;

import com.di.enrichment.config.EnrichmentProperties;
import com.di.enrichment.model.DataTypes;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Motor vehicle record: driver history plus a derived risk assessment.
 */
@Component
@ConditionalOnProperty(prefix = "enrichment.providers", name = "simulated-enabled", havingValue = "true", matchIfMissing = true)
public class SimulatedDrivingRecordProvider extends SimulatedProvider {

    public SimulatedDrivingRecordProvider(ObjectMapper objectMapper, EnrichmentProperties properties) {
        super(objectMapper, properties);
    }

    @Override
    public String dataType() {
        return DataTypes.DRIVING_RECORD;
    }

    @Override
    protected void generate(Random random, ObjectNode payload) {
        int violations = random.nextInt(4);
        int duis = random.nextDouble() < 0.05 ? 1 : 0;

        ObjectNode driver = payload.putObject("driver");
        driver.put("licenseStatus", "valid");
        driver.put("violationCount", violations);
        driver.put("duiCount", duis);
        driver.put("trafficPoints", random.nextInt(8));

        int riskScore = 50;
        if (violations >= 4) riskScore += 30;
        else if (violations >= 2) riskScore += 15;
        if (duis > 0) riskScore += 40;
        riskScore = Math.min(100, riskScore);

        ObjectNode risk = payload.putObject("riskAssessment");
        risk.put("risk_score", riskScore);
        risk.put("risk_level", riskLevel(riskScore));
        risk.put("violation_count", violations);
        risk.put("dui_count", duis);
    }

    static String riskLevel(int riskScore) {
        if (riskScore > 80) return "high";
        if (riskScore > 60) return "poor";
        if (riskScore > 40) return "fair";
        if (riskScore > 20) return "good";
        return "excellent";
    }
}
