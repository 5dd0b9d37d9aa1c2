package com.di.enrichment.provider;

/**
 * A single data type's fetch failed. The pipeline converts it into an entry of the run's error
 * list unless the fallback behavior is manual review.
 */
public class ProviderException extends Exception {

    private final String dataType;

    public ProviderException(String dataType, String message) {
        super(message);
        this.dataType = dataType;
    }

    public ProviderException(String dataType, String message, Throwable cause) {
        super(message, cause);
        this.dataType = dataType;
    }

    public String getDataType() {
        return dataType;
    }
}
