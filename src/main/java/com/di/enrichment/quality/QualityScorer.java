package com.di.enrichment.quality;

import com.di.enrichment.cache.CacheRetentionPolicy;
import com.di.enrichment.model.DataTypes;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Scores a merged payload on completeness, accuracy, freshness and consistency.
 * The composite is {@code 100 * mean(subScores)}, clamped to [0, 100]. Only obtained data is
 * considered; an empty payload scores 0.
 */
@Component
public class QualityScorer {

    static final double ACCURACY_BASELINE = 0.9;
    static final double PENALTY = 0.2;

    /** JSON pointers of the fields each built-in source is expected to carry. */
    private static final Map<String, List<String>> EXPECTED_FIELDS = Map.of(
            DataTypes.DRIVING_RECORD, List.of(
                    "/driver/licenseStatus", "/driver/violationCount", "/driver/duiCount",
                    "/driver/trafficPoints", "/riskAssessment/risk_level"),
            DataTypes.PRIOR_CLAIMS, List.of(
                    "/claims/totalClaims5yr", "/claims/totalClaims10yr", "/claims/recentClaimAmount",
                    "/insuranceScore/risk_level"),
            DataTypes.CREDIT, List.of(
                    "/creditScore", "/creditScoreRange", "/currentDelinquencies", "/pastDelinquencies",
                    "/bankruptcyHistory", "/inquiries12mo"),
            DataTypes.BACKGROUND, List.of(
                    "/criminalRecord", "/felonyCount", "/fraudHistory", "/ssnVerified", "/addressChanges"));

    private static final Map<String, Integer> RISK_TIERS = Map.of(
            "excellent", 0,
            "good", 1,
            "fair", 2,
            "poor", 3,
            "high", 4,
            "very_poor", 4);

    private final CacheRetentionPolicy retentionPolicy;
    private final Clock clock;

    public QualityScorer(CacheRetentionPolicy retentionPolicy, Clock clock) {
        this.retentionPolicy = retentionPolicy;
        this.clock = clock;
    }

    public QualityReport score(MergedPayload merged) {
        if (merged == null || merged.isEmpty()) {
            return QualityReport.EMPTY;
        }
        double completeness = completeness(merged);
        double accuracy = accuracy(merged);
        double freshness = freshness(merged);
        double consistency = consistency(merged);
        double score = clamp(100.0 * (completeness + accuracy + freshness + consistency) / 4.0, 0.0, 100.0);
        return QualityReport.builder()
                .score(score)
                .completeness(completeness)
                .accuracy(accuracy)
                .freshness(freshness)
                .consistency(consistency)
                .build();
    }

    double completeness(MergedPayload merged) {
        int expected = 0;
        int present = 0;
        for (SourcedPayload sourced : merged.entries()) {
            JsonNode payload = sourced.getPayload();
            List<String> fields = EXPECTED_FIELDS.get(sourced.getDataType());
            if (fields != null) {
                for (String pointer : fields) {
                    expected++;
                    if (hasValue(payload == null ? null : payload.at(pointer))) present++;
                }
            } else if (payload != null && payload.isObject() && payload.size() > 0) {
                Iterator<JsonNode> values = payload.elements();
                while (values.hasNext()) {
                    expected++;
                    if (hasValue(values.next())) present++;
                }
            } else {
                expected++;
                if (hasValue(payload)) present++;
            }
        }
        return expected == 0 ? 0.0 : (double) present / expected;
    }

    double accuracy(MergedPayload merged) {
        List<Integer> tiers = new ArrayList<>();
        addTier(tiers, merged.payload(DataTypes.DRIVING_RECORD), "/riskAssessment/risk_level");
        addTier(tiers, merged.payload(DataTypes.PRIOR_CLAIMS), "/insuranceScore/risk_level");
        addTier(tiers, merged.payload(DataTypes.CREDIT), "/creditScoreRange");

        double accuracy = ACCURACY_BASELINE;
        for (int i = 0; i < tiers.size(); i++) {
            for (int j = i + 1; j < tiers.size(); j++) {
                if (Math.abs(tiers.get(i) - tiers.get(j)) > 1) {
                    accuracy -= PENALTY;
                }
            }
        }
        return clamp(accuracy, 0.0, 1.0);
    }

    double freshness(MergedPayload merged) {
        Instant now = clock.instant();
        double total = 0.0;
        for (SourcedPayload sourced : merged.entries()) {
            Duration retention = retentionPolicy.ttlFor(sourced.getDataType());
            Instant obtainedAt = sourced.getObtainedAt() != null ? sourced.getObtainedAt() : now;
            long ageMillis = Math.max(0L, Duration.between(obtainedAt, now).toMillis());
            long retentionMillis = Math.max(1L, retention.toMillis());
            total += clamp(1.0 - (double) ageMillis / retentionMillis, 0.0, 1.0);
        }
        return total / merged.size();
    }

    double consistency(MergedPayload merged) {
        double consistency = 1.0;

        JsonNode credit = merged.payload(DataTypes.CREDIT);
        if (credit != null && credit.path("creditScore").isNumber()
                && credit.path("creditScore").asDouble() < 500 && noRiskIndicatorsElsewhere(merged)) {
            consistency -= PENALTY;
        }

        JsonNode claims = merged.payload(DataTypes.PRIOR_CLAIMS);
        if (claims != null) {
            JsonNode fiveYear = claims.at("/claims/totalClaims5yr");
            JsonNode tenYear = claims.at("/claims/totalClaims10yr");
            if (fiveYear.isNumber() && tenYear.isNumber() && tenYear.asInt() < fiveYear.asInt()) {
                consistency -= PENALTY;
            }
        }

        JsonNode background = merged.payload(DataTypes.BACKGROUND);
        if (background != null && background.path("felonyCount").asInt(0) > 0
                && !background.path("criminalRecord").asBoolean(false)) {
            consistency -= PENALTY;
        }
        return clamp(consistency, 0.0, 1.0);
    }

    /**
     * True when at least one other risk source is present and none of them reports a risk indicator.
     */
    private static boolean noRiskIndicatorsElsewhere(MergedPayload merged) {
        boolean anySource = false;
        JsonNode driving = merged.payload(DataTypes.DRIVING_RECORD);
        if (driving != null) {
            anySource = true;
            if (driving.at("/driver/violationCount").asInt(0) > 0 || driving.at("/driver/duiCount").asInt(0) > 0) {
                return false;
            }
        }
        JsonNode claims = merged.payload(DataTypes.PRIOR_CLAIMS);
        if (claims != null) {
            anySource = true;
            if (claims.at("/claims/totalClaims5yr").asInt(0) > 0) {
                return false;
            }
        }
        JsonNode background = merged.payload(DataTypes.BACKGROUND);
        if (background != null) {
            anySource = true;
            if (background.path("criminalRecord").asBoolean(false) || background.path("fraudHistory").asBoolean(false)) {
                return false;
            }
        }
        return anySource;
    }

    private static void addTier(List<Integer> tiers, JsonNode payload, String pointer) {
        if (payload == null) return;
        JsonNode level = payload.at(pointer);
        if (!level.isTextual()) return;
        Integer tier = RISK_TIERS.get(level.asText().trim().toLowerCase());
        if (tier != null) tiers.add(tier);
    }

    private static boolean hasValue(JsonNode node) {
        return node != null && !node.isMissingNode() && !node.isNull();
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
