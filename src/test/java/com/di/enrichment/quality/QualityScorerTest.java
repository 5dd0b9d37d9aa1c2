package com.di.enrichment.quality;

import com.di.enrichment.cache.CacheRetentionPolicy;
import com.di.enrichment.config.EnrichmentProperties;
import com.di.enrichment.model.DataTypes;
import com.di.enrichment.support.MutableClock;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.di.enrichment.support.Payloads.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QualityScorer Tests")
class QualityScorerTest {

    private static final double EPS = 1e-9;

    private MutableClock clock;
    private QualityScorer scorer;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        scorer = new QualityScorer(new CacheRetentionPolicy(new EnrichmentProperties()), clock);
    }

    private SourcedPayload fresh(String dataType, JsonNode payload) {
        return SourcedPayload.builder()
                .dataType(dataType)
                .payload(payload)
                .origin(SourcedPayload.Origin.FRESH)
                .obtainedAt(clock.instant())
                .build();
    }

    private SourcedPayload cached(String dataType, JsonNode payload, Duration age) {
        return SourcedPayload.builder()
                .dataType(dataType)
                .payload(payload)
                .origin(SourcedPayload.Origin.CACHE)
                .obtainedAt(clock.instant().minus(age))
                .confidence(80.0)
                .build();
    }

    @Test
    @DisplayName("Empty payload scores 0")
    void testEmpty() {
        QualityReport report = scorer.score(new MergedPayload());
        assertEquals(0.0, report.getScore());
    }

    @Test
    @DisplayName("Complete, fresh, agreeing sources score 97.5")
    void testCleanPayload() {
        MergedPayload merged = new MergedPayload()
                .put(fresh(DataTypes.DRIVING_RECORD, drivingRecord(1, "good")))
                .put(fresh(DataTypes.PRIOR_CLAIMS, priorClaims(1, 1, "good")))
                .put(fresh(DataTypes.CREDIT, credit(700, "good")))
                .put(fresh(DataTypes.BACKGROUND, background(false, 0, false)));

        QualityReport report = scorer.score(merged);
        assertEquals(1.0, report.getCompleteness(), EPS);
        assertEquals(0.9, report.getAccuracy(), EPS);
        assertEquals(1.0, report.getFreshness(), EPS);
        assertEquals(1.0, report.getConsistency(), EPS);
        assertEquals(97.5, report.getScore(), EPS);
    }

    @Test
    @DisplayName("Each pair of risk tiers more than one apart costs 0.2 accuracy")
    void testAccuracyPenalties() {
        MergedPayload merged = new MergedPayload()
                .put(fresh(DataTypes.DRIVING_RECORD, drivingRecord(4, "high")))
                .put(fresh(DataTypes.PRIOR_CLAIMS, priorClaims(0, 0, "excellent")))
                .put(fresh(DataTypes.CREDIT, credit(700, "good")));

        assertEquals(0.5, scorer.accuracy(merged), EPS);
    }

    @Test
    @DisplayName("Adjacent tiers keep the baseline accuracy")
    void testAccuracyAdjacentTiers() {
        MergedPayload merged = new MergedPayload()
                .put(fresh(DataTypes.DRIVING_RECORD, drivingRecord(2, "fair")))
                .put(fresh(DataTypes.CREDIT, credit(480, "poor")));
        assertEquals(0.9, scorer.accuracy(merged), EPS);
    }

    @Test
    @DisplayName("Freshness decays linearly over the retention window")
    void testFreshness() {
        MergedPayload merged = new MergedPayload()
                .put(fresh(DataTypes.DRIVING_RECORD, drivingRecord(1, "good")))
                .put(cached(DataTypes.CREDIT, credit(700, "good"), Duration.ofDays(15)));
        assertEquals(0.75, scorer.freshness(merged), EPS);

        MergedPayload expired = new MergedPayload()
                .put(cached(DataTypes.BACKGROUND, background(false, 0, false), Duration.ofDays(20)));
        assertEquals(0.0, scorer.freshness(expired), EPS);
    }

    @Test
    @DisplayName("Low credit with no risk indicator elsewhere costs 0.2 consistency")
    void testLowCreditWithoutRiskIndicators() {
        MergedPayload merged = new MergedPayload()
                .put(fresh(DataTypes.DRIVING_RECORD, drivingRecord(0, "excellent")))
                .put(fresh(DataTypes.PRIOR_CLAIMS, priorClaims(0, 0, "excellent")))
                .put(fresh(DataTypes.CREDIT, credit(450, "poor")));
        assertEquals(0.8, scorer.consistency(merged), EPS);
    }

    @Test
    @DisplayName("Low credit alone, or alongside a risk indicator, is consistent")
    void testLowCreditWithRiskIndicators() {
        MergedPayload alone = new MergedPayload().put(fresh(DataTypes.CREDIT, credit(450, "poor")));
        assertEquals(1.0, scorer.consistency(alone), EPS);

        MergedPayload withClaims = new MergedPayload()
                .put(fresh(DataTypes.PRIOR_CLAIMS, priorClaims(2, 2, "fair")))
                .put(fresh(DataTypes.CREDIT, credit(450, "poor")));
        assertEquals(1.0, scorer.consistency(withClaims), EPS);
    }

    @Test
    @DisplayName("Fewer 10-year than 5-year claims and felonies without a record are inconsistent")
    void testOtherConsistencyRules() {
        MergedPayload merged = new MergedPayload()
                .put(fresh(DataTypes.PRIOR_CLAIMS, priorClaims(2, 1, "fair")))
                .put(fresh(DataTypes.BACKGROUND, background(false, 1, false)));
        assertEquals(0.6, scorer.consistency(merged), EPS);
    }

    @Test
    @DisplayName("Missing and null expected fields lower completeness")
    void testCompletenessKnownType() {
        JsonNode partialCredit = json("{\"creditScore\":700,\"creditScoreRange\":\"good\","
                + "\"currentDelinquencies\":0,\"pastDelinquencies\":0,\"bankruptcyHistory\":null}");
        MergedPayload merged = new MergedPayload().put(fresh(DataTypes.CREDIT, partialCredit));
        assertEquals(4.0 / 6.0, scorer.completeness(merged), EPS);
    }

    @Test
    @DisplayName("Unknown data types use their top-level fields for completeness")
    void testCompletenessUnknownType() {
        MergedPayload merged = new MergedPayload().put(fresh("telematics", json("{\"miles\":1200,\"hardBrakes\":null}")));
        assertEquals(0.5, scorer.completeness(merged), EPS);
    }

    @Test
    @DisplayName("Composite score is always within [0,100]")
    void testScoreRange() {
        MergedPayload worst = new MergedPayload()
                .put(cached(DataTypes.DRIVING_RECORD, json("{}"), Duration.ofDays(90)))
                .put(fresh(DataTypes.PRIOR_CLAIMS, priorClaims(3, 1, "excellent")))
                .put(fresh(DataTypes.CREDIT, credit(320, "very_poor")))
                .put(fresh(DataTypes.BACKGROUND, background(false, 2, false)));
        double score = scorer.score(worst).getScore();
        assertTrue(score >= 0.0 && score <= 100.0, "score " + score);
    }
}
