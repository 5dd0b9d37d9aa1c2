package com.di.enrichment.provider.simulated;

import com.di.enrichment.config.EnrichmentProperties;
import com.di.enrichment.model.DataTypes;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Random;

@Component
@ConditionalOnProperty(prefix = "enrichment.providers", name = "simulated-enabled", havingValue = "true", matchIfMissing = true)
public class SimulatedCreditProvider extends SimulatedProvider {

    public SimulatedCreditProvider(ObjectMapper objectMapper, EnrichmentProperties properties) {
        super(objectMapper, properties);
    }

    @Override
    public String dataType() {
        return DataTypes.CREDIT;
    }

    @Override
    protected void generate(Random random, ObjectNode payload) {
        int creditScore = creditScore(random);
        payload.put("creditScore", creditScore);
        payload.put("creditScoreRange", creditRange(creditScore));
        payload.put("currentDelinquencies", random.nextInt(3));
        payload.put("pastDelinquencies", random.nextInt(5));
        payload.put("bankruptcyHistory", random.nextDouble() < 0.07);
        payload.put("inquiries12mo", random.nextInt(6));
    }

    private static int creditScore(Random random) {
        double band = random.nextDouble();
        if (band < 0.05) return 300 + random.nextInt(100);
        if (band < 0.15) return 400 + random.nextInt(100);
        if (band < 0.30) return 500 + random.nextInt(100);
        if (band < 0.70) return 600 + random.nextInt(150);
        return 750 + random.nextInt(101);
    }

    static String creditRange(int score) {
        if (score >= 750) return "excellent";
        if (score >= 650) return "good";
        if (score >= 550) return "fair";
        if (score >= 450) return "poor";
        return "very_poor";
    }
}
