package com.di.enrichment.model;

import java.util.Arrays;

/**
 * Kind of entity being enriched.
 */
public enum EntityKind {

    POLICY("policy"),
    CLAIM("claim");

    private final String code;

    EntityKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolves a kind from its code or enum name (case-insensitive).
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static EntityKind fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Entity kind cannot be null or blank");
        }
        String v = value.trim();
        return Arrays.stream(values())
                .filter(k -> k.code.equalsIgnoreCase(v) || k.name().equalsIgnoreCase(v))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown entity kind: '" + value + "'"));
    }

    @Override
    public String toString() {
        return code;
    }
}
