package com.di.enrichment.exception;

/**
 * Failure to read or write the cache store or the task store. Fatal for the enrichment run in
 * progress: task bookkeeping cannot be trusted once a store call has failed.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
