package com.di.enrichment.exception;

import com.di.enrichment.provider.ProviderException;
import com.fasterxml.jackson.core.JsonParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.springframework.dao.DataAccessResourceFailureException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.sql.SQLException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ErrorCategory Tests")
class ErrorCategoryTest {

    @Test
    @DisplayName("Every category has a name, description and lower-case tag")
    void testNamesAndTags() {
        for (ErrorCategory category : ErrorCategory.values()) {
            assertFalse(category.getName().isEmpty());
            assertFalse(category.getDescription().isEmpty());
            assertEquals(category.name().toLowerCase(), category.tag());
        }
    }

    static Stream<Arguments> direct() {
        return Stream.of(
                Arguments.of(new TimeoutException(), ErrorCategory.TIMEOUT_ERROR),
                Arguments.of(new SocketTimeoutException("read"), ErrorCategory.TIMEOUT_ERROR),
                Arguments.of(new ConnectException("refused"), ErrorCategory.NETWORK_ERROR),
                Arguments.of(new StoreException("write failed"), ErrorCategory.STORE_ERROR),
                Arguments.of(new SQLException("bad"), ErrorCategory.STORE_ERROR),
                Arguments.of(new DataAccessResourceFailureException("down"), ErrorCategory.STORE_ERROR),
                Arguments.of(new JsonParseException(null, "bad json"), ErrorCategory.SERIALIZATION_ERROR),
                Arguments.of(new IllegalArgumentException("bad input"), ErrorCategory.VALIDATION_ERROR),
                Arguments.of(new ProviderException("credit", "bureau unavailable"), ErrorCategory.PROVIDER_ERROR),
                Arguments.of(new RuntimeException("boom"), ErrorCategory.APPLICATION_ERROR)
        );
    }

    @ParameterizedTest
    @MethodSource("direct")
    @DisplayName("Categorizes exceptions by type")
    void testCategorize(Throwable error, ErrorCategory expected) {
        assertEquals(expected, ErrorCategory.categorize(error));
    }

    @Test
    @DisplayName("Looks through async and provider wrappers at the cause")
    void testUnwrapsCauses() {
        assertEquals(ErrorCategory.TIMEOUT_ERROR,
                ErrorCategory.categorize(new CompletionException(new TimeoutException())));
        assertEquals(ErrorCategory.NETWORK_ERROR,
                ErrorCategory.categorize(new ProviderException("credit", "call failed", new ConnectException("refused"))));
        assertEquals(ErrorCategory.PROVIDER_ERROR,
                ErrorCategory.categorize(new ExecutionException(new ProviderException("credit", "bureau unavailable"))));
    }

    @Test
    @DisplayName("Null is UNKNOWN")
    void testNull() {
        assertEquals(ErrorCategory.UNKNOWN, ErrorCategory.categorize(null));
    }
}
