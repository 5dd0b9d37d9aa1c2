package com.di.enrichment.quality;

import lombok.Builder;
import lombok.Value;

/**
 * Composite quality score (0–100) and the four sub-scores (each 0–1) it averages.
 */
@Value
@Builder
public class QualityReport {

    public static final QualityReport EMPTY = QualityReport.builder().build();

    double score;
    double completeness;
    double accuracy;
    double freshness;
    double consistency;
}
