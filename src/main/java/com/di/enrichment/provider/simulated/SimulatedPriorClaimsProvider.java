package com.di.enrichment.provider.simulated;

import com.di.enrichment.config.EnrichmentProperties;
import com.di.enrichment.model.DataTypes;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Prior-claims history report with an insurance score.
 */
@Component
@ConditionalOnProperty(prefix = "enrichment.providers", name = "simulated-enabled", havingValue = "true", matchIfMissing = true)
public class SimulatedPriorClaimsProvider extends SimulatedProvider {

    private static final String[] CLAIM_TYPES = {"water", "fire", "theft"};

    public SimulatedPriorClaimsProvider(ObjectMapper objectMapper, EnrichmentProperties properties) {
        super(objectMapper, properties);
    }

    @Override
    public String dataType() {
        return DataTypes.PRIOR_CLAIMS;
    }

    @Override
    protected void generate(Random random, ObjectNode payload) {
        int claimCount = random.nextInt(4);
        boolean hasClaims = claimCount > 0;

        ObjectNode claims = payload.putObject("claims");
        claims.put("totalClaims5yr", claimCount);
        claims.put("totalClaims10yr", claimCount + random.nextInt(2));
        claims.put("recentClaimAmount", hasClaims ? Math.round(random.nextDouble() * 20000 + 1000) : 0);
        if (hasClaims) {
            claims.put("worstClaimType", CLAIM_TYPES[random.nextInt(CLAIM_TYPES.length)]);
        } else {
            claims.putNull("worstClaimType");
        }

        int score = 70;
        int adjustment = 0;
        if (claimCount == 0) {
            score += 20;
            adjustment -= 15;
        } else if (claimCount >= 3) {
            score -= 35;
            adjustment += 50;
        }

        ObjectNode insuranceScore = payload.putObject("insuranceScore");
        insuranceScore.put("insurance_score", score);
        insuranceScore.put("risk_level", scoreLevel(score));
        insuranceScore.put("quote_adjustment", adjustment);
    }

    static String scoreLevel(int score) {
        if (score < 50) return "poor";
        if (score < 65) return "fair";
        if (score < 80) return "good";
        return "excellent";
    }
}
