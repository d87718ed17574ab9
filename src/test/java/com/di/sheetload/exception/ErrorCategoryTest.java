package com.di.sheetload.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.nio.file.NoSuchFileException;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for ErrorCategory enum.
 */
@DisplayName("ErrorCategory Tests")
class ErrorCategoryTest {

    // ============================================================================
    // Ingestion Exception Categorization Tests
    // ============================================================================

    static Stream<Arguments> ingestionExceptions() {
        return Stream.of(
                Arguments.of(new MalformedSourceException("no header", 4), ErrorCategory.SOURCE_FORMAT_ERROR),
                Arguments.of(new AnchorNotFoundException("business-unit", List.of("BU"), 4), ErrorCategory.SCHEMA_DRIFT_ERROR),
                Arguments.of(new SchemaTooNarrowException(120, 132, "too few columns"), ErrorCategory.SCHEMA_DRIFT_ERROR),
                Arguments.of(new PositionalDriftException("Title", 1, 2, "found at column 2"), ErrorCategory.SCHEMA_DRIFT_ERROR),
                Arguments.of(new BackendUnresolvedException("password without user"), ErrorCategory.CONFIGURATION_ERROR),
                Arguments.of(new BackendConnectionException("refused", null), ErrorCategory.CONNECTION_ERROR),
                Arguments.of(new SchemaMismatchException("research_data", List.of("Title")), ErrorCategory.SCHEMA_MISMATCH),
                Arguments.of(new PartialLoadException(2, 2, 1000, new SQLException("boom")), ErrorCategory.PARTIAL_LOAD)
        );
    }

    @ParameterizedTest
    @MethodSource("ingestionExceptions")
    @DisplayName("Should use the category carried by ingestion exceptions")
    void testCategorize_IngestionExceptions(IngestionException exception, ErrorCategory expected) {
        assertEquals(expected, ErrorCategory.categorize(exception));
        assertEquals(expected, exception.getCategory());
    }

    @Test
    @DisplayName("Should carry the source or load location of the failure")
    void testIngestionException_Location() {
        assertEquals("sheet row 4", new MalformedSourceException("no header", 4).getLocation().orElseThrow());
        assertEquals("column 2", new PositionalDriftException("Title", 1, 2, "moved").getLocation().orElseThrow());
        assertEquals("batch 3", new PartialLoadException(3, 3, 1500, null).getLocation().orElseThrow());
        assertTrue(new BackendUnresolvedException("inconsistent").getLocation().isEmpty());
    }

    // ============================================================================
    // SQL Exception Categorization Tests
    // ============================================================================

    @Test
    @DisplayName("Should categorize SQL exceptions by SQL state")
    void testCategorize_SqlState() {
        assertEquals(ErrorCategory.CONNECTION_ERROR, ErrorCategory.categorize(new SQLException("Connection failed", "08001")));
        assertEquals(ErrorCategory.CONSTRAINT_VIOLATION, ErrorCategory.categorize(new SQLException("Duplicate", "23000")));
        assertEquals(ErrorCategory.SQL_SYNTAX_ERROR, ErrorCategory.categorize(new SQLException("Syntax error", "42000")));
        assertEquals(ErrorCategory.TRANSACTION_ROLLBACK, ErrorCategory.categorize(new SQLException("Deadlock", "40001")));
        assertEquals(ErrorCategory.VALIDATION_ERROR, ErrorCategory.categorize(new SQLException("Data too long", "22001")));
    }

    @Test
    @DisplayName("Should categorize SQL errors by message when SQL state unavailable")
    void testCategorize_SqlErrorByMessage() {
        assertEquals(ErrorCategory.CONNECTION_ERROR, ErrorCategory.categorize(new SQLException("Connection timeout occurred")));
        assertEquals(ErrorCategory.SQL_SYNTAX_ERROR, ErrorCategory.categorize(new SQLException("Unknown column 'Title'")));
        assertEquals(ErrorCategory.DATABASE_ERROR, ErrorCategory.categorize(new SQLException("Something else")));
    }

    // ============================================================================
    // Other Exception Categorization Tests
    // ============================================================================

    @Test
    @DisplayName("Should categorize network, timeout, validation and resource errors")
    void testCategorize_ForeignExceptions() {
        assertEquals(ErrorCategory.NETWORK_ERROR, ErrorCategory.categorize(new SocketTimeoutException("timed out")));
        assertEquals(ErrorCategory.NETWORK_ERROR, ErrorCategory.categorize(new ConnectException("Connection refused")));
        assertEquals(ErrorCategory.TIMEOUT_ERROR, ErrorCategory.categorize(new TimeoutException("Operation timed out")));
        assertEquals(ErrorCategory.VALIDATION_ERROR, ErrorCategory.categorize(new IllegalArgumentException("bad")));
        assertEquals(ErrorCategory.RESOURCE_ERROR, ErrorCategory.categorize(new NoSuchFileException("/data/x.xlsx")));
    }

    @Test
    @DisplayName("Should handle null and unclassified exceptions")
    void testCategorize_NullAndUnknown() {
        assertEquals(ErrorCategory.UNKNOWN, ErrorCategory.categorize(null));
        assertEquals(ErrorCategory.APPLICATION_ERROR, ErrorCategory.categorize(new RuntimeException("generic")));
    }
}
