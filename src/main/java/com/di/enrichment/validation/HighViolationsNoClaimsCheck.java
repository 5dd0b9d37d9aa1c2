package com.di.enrichment.validation;

import com.di.enrichment.model.DataTypes;
import com.di.enrichment.quality.MergedPayload;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * More than five driving violations alongside zero five-year claims suggests a gap in one of the
 * two sources.
 */
@Component
public class HighViolationsNoClaimsCheck implements CrossSourceCheck {

    public static final String CODE = "HIGH_VIOLATIONS_NO_CLAIMS";
    static final int VIOLATION_THRESHOLD = 5;

    @Override
    public Optional<ValidationNotice> check(MergedPayload merged) {
        JsonNode driving = merged.payload(DataTypes.DRIVING_RECORD);
        JsonNode claims = merged.payload(DataTypes.PRIOR_CLAIMS);
        if (driving == null || claims == null) {
            return Optional.empty();
        }
        JsonNode violations = driving.at("/driver/violationCount");
        JsonNode claims5yr = claims.at("/claims/totalClaims5yr");
        if (violations.isNumber() && claims5yr.isNumber()
                && violations.asInt() > VIOLATION_THRESHOLD && claims5yr.asInt() == 0) {
            return Optional.of(ValidationNotice.of(CODE,
                    "High violations but no claims may indicate data gap",
                    DataTypes.DRIVING_RECORD, DataTypes.PRIOR_CLAIMS));
        }
        return Optional.empty();
    }
}
