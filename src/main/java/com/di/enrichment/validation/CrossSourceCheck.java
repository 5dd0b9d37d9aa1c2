package com.di.enrichment.validation;

import com.di.enrichment.quality.MergedPayload;

import java.util.Optional;

/**
 * One consistency rule across data sources. Register an implementation as a Spring bean to have
 * {@link CrossSourceValidator} run it on every merged payload.
 */
@FunctionalInterface
public interface CrossSourceCheck {

    /**
     * Returns a notice when the rule fires. Must not throw for missing data types.
     */
    Optional<ValidationNotice> check(MergedPayload merged);
}
