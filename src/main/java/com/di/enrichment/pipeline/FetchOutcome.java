package com.di.enrichment.pipeline;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Result of one provider call as seen by the collecting thread: either a payload or an error message.
 */
record FetchOutcome(String dataType, JsonNode payload, String error, Throwable cause, Instant completedAt) {

    static FetchOutcome success(String dataType, JsonNode payload, Instant completedAt) {
        return new FetchOutcome(dataType, payload, null, null, completedAt);
    }

    static FetchOutcome failure(String dataType, String error, Throwable cause, Instant completedAt) {
        return new FetchOutcome(dataType, null, error, cause, completedAt);
    }

    boolean isSuccess() {
        return error == null;
    }
}
