package com.di.enrichment.exception;

import com.di.enrichment.provider.ProviderException;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories for pipeline log lines and metric tags.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum ErrorCategory {

    TIMEOUT_ERROR("Timeout error", "Provider or store call exceeded its time limit"),
    NETWORK_ERROR("Network error", "Network communication failure"),
    STORE_ERROR("Store error", "Cache or task store read/write failure"),
    SERIALIZATION_ERROR("Serialization error", "Payload serialization or deserialization failure"),
    VALIDATION_ERROR("Validation error", "Input validation or state rule violation"),
    PROVIDER_ERROR("Provider error", "Data provider returned an error"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(ErrorCategory::isStoreError, STORE_ERROR);
        MATCHERS.put(ErrorCategory::isSerializationError, SERIALIZATION_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(t -> t instanceof ProviderException, PROVIDER_ERROR);
    }

    /**
     * Categorizes the exception, looking through {@link ProviderException} and
     * {@link java.util.concurrent.CompletionException} wrappers at their cause first.
     */
    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        Throwable cause = exception.getCause();
        if (cause != null && cause != exception
                && (exception instanceof ProviderException
                || exception instanceof java.util.concurrent.CompletionException
                || exception instanceof java.util.concurrent.ExecutionException)) {
            ErrorCategory byCause = categorize(cause);
            if (byCause != APPLICATION_ERROR) {
                return byCause;
            }
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    // --- Matcher helpers ---

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException
                || messageContains(t, "timeout", "timed out");
    }

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException
                || t instanceof java.net.http.HttpTimeoutException;
    }

    private static boolean isStoreError(Throwable t) {
        return t instanceof StoreException
                || t instanceof SQLException
                || t instanceof org.springframework.dao.DataAccessException;
    }

    private static boolean isSerializationError(Throwable t) {
        return t instanceof com.fasterxml.jackson.core.JsonProcessingException
                || t instanceof java.io.NotSerializableException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException;
    }

    private static boolean messageContains(Throwable t, String... keywords) {
        String msg = t.getMessage();
        if (msg == null) return false;
        String lower = msg.toLowerCase();
        for (String k : keywords) {
            if (lower.contains(k)) return true;
        }
        return false;
    }

    /** Lower-case name for metric tags, e.g. {@code timeout_error}. */
    public String tag() {
        return name().toLowerCase();
    }

    @Override
    public String toString() {
        return name();
    }
}
