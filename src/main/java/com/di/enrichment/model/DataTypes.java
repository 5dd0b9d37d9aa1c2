package com.di.enrichment.model;

import java.util.List;

/**
 * Names of the well-known enrichment data types. Data types are plain strings so that new
 * providers can be plugged in without touching this class; these constants only cover the
 * sources the pipeline ships with.
 */
public final class DataTypes {

    public static final String DRIVING_RECORD = "driving-record";
    public static final String PRIOR_CLAIMS = "prior-claims";
    public static final String CREDIT = "credit";
    public static final String BACKGROUND = "background";

    /** Default data types for a policy run, in request order. */
    public static final List<String> ALL = List.of(DRIVING_RECORD, PRIOR_CLAIMS, BACKGROUND, CREDIT);

    private DataTypes() {
    }

    /**
     * Normalizes a data type name for lookups (trimmed, lower-case). Returns null for blank input.
     */
    public static String normalize(String dataType) {
        if (dataType == null || dataType.isBlank()) return null;
        return dataType.trim().toLowerCase();
    }
}
