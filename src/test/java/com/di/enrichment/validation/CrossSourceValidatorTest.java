package com.di.enrichment.validation;

import com.di.enrichment.model.DataTypes;
import com.di.enrichment.quality.MergedPayload;
import com.di.enrichment.quality.SourcedPayload;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.di.enrichment.support.Payloads.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CrossSourceValidator Tests")
class CrossSourceValidatorTest {

    private static SourcedPayload fresh(String dataType, JsonNode payload) {
        return SourcedPayload.builder()
                .dataType(dataType)
                .payload(payload)
                .origin(SourcedPayload.Origin.FRESH)
                .obtainedAt(Instant.parse("2024-03-01T10:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("High violations with no claims produce a notice")
    void testHighViolationsNoClaims() {
        CrossSourceValidator validator = new CrossSourceValidator(List.of(new HighViolationsNoClaimsCheck()));
        MergedPayload merged = new MergedPayload()
                .put(fresh(DataTypes.DRIVING_RECORD, drivingRecord(6, "poor")))
                .put(fresh(DataTypes.PRIOR_CLAIMS, priorClaims(0, 0, "excellent")));

        List<ValidationNotice> notices = validator.validate(merged);
        assertEquals(1, notices.size());
        assertEquals(HighViolationsNoClaimsCheck.CODE, notices.get(0).getCode());
        assertEquals(List.of(DataTypes.DRIVING_RECORD, DataTypes.PRIOR_CLAIMS), notices.get(0).getDataTypes());
    }

    @Test
    @DisplayName("Exactly five violations, or any claim, is not flagged")
    void testThreshold() {
        CrossSourceValidator validator = new CrossSourceValidator(List.of(new HighViolationsNoClaimsCheck()));
        assertTrue(validator.validate(new MergedPayload()
                .put(fresh(DataTypes.DRIVING_RECORD, drivingRecord(5, "poor")))
                .put(fresh(DataTypes.PRIOR_CLAIMS, priorClaims(0, 0, "excellent")))).isEmpty());
        assertTrue(validator.validate(new MergedPayload()
                .put(fresh(DataTypes.DRIVING_RECORD, drivingRecord(9, "high")))
                .put(fresh(DataTypes.PRIOR_CLAIMS, priorClaims(1, 1, "good")))).isEmpty());
    }

    @Test
    @DisplayName("Missing sources skip the check")
    void testMissingSource() {
        CrossSourceValidator validator = new CrossSourceValidator(List.of(new HighViolationsNoClaimsCheck()));
        assertTrue(validator.validate(new MergedPayload()
                .put(fresh(DataTypes.DRIVING_RECORD, drivingRecord(9, "high")))).isEmpty());
    }

    @Test
    @DisplayName("A throwing check is skipped and the others still run")
    void testThrowingCheckIsSkipped() {
        CrossSourceCheck broken = merged -> {
            throw new IllegalStateException("boom");
        };
        CrossSourceCheck always = merged -> Optional.of(ValidationNotice.of("ALWAYS", "always fires"));
        CrossSourceValidator validator = new CrossSourceValidator(List.of(broken, always));

        List<ValidationNotice> notices = validator.validate(new MergedPayload()
                .put(fresh(DataTypes.CREDIT, credit(700, "good"))));
        assertEquals(List.of("ALWAYS"), notices.stream().map(ValidationNotice::getCode).toList());
    }
}
