package com.di.enrichment.validation;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Informational finding from a cross-source check. Never fails a run.
 */
@Value
@Builder
public class ValidationNotice {

    /** Stable machine-readable code, e.g. {@code HIGH_VIOLATIONS_NO_CLAIMS}. */
    String code;
    String message;
    /** Data types the finding is about. */
    List<String> dataTypes;

    public static ValidationNotice of(String code, String message, String... dataTypes) {
        return ValidationNotice.builder()
                .code(code)
                .message(message)
                .dataTypes(List.of(dataTypes))
                .build();
    }
}
