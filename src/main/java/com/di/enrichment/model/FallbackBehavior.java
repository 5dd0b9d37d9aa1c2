package com.di.enrichment.model;

import java.util.Arrays;

/**
 * What the pipeline does when a single data type's fetch fails.
 */
public enum FallbackBehavior {

    /** Record the error, mark the data type failed and carry on. */
    SKIP("skip"),
    /** Substitute the last cached value regardless of age, with reduced confidence; else behave as SKIP. */
    USE_CACHED("use_cached"),
    /** Abort the whole run on the first failure. */
    MANUAL_REVIEW("manual_review");

    private final String code;

    FallbackBehavior(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolves a behavior from its code or enum name; null or blank resolves to {@link #SKIP}.
     */
    public static FallbackBehavior fromCode(String value) {
        if (value == null || value.isBlank()) return SKIP;
        String v = value.trim();
        return Arrays.stream(values())
                .filter(b -> b.code.equalsIgnoreCase(v) || b.name().equalsIgnoreCase(v))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown fallback behavior: '" + value + "'"));
    }

    @Override
    public String toString() {
        return code;
    }
}
