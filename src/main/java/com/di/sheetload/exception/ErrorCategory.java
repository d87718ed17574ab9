package com.di.sheetload.exception;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories for ingestion failures, used in logs and REST error bodies.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>Ingestion exceptions carry their own category; foreign exceptions are classified by SQL state
 * and then by the matchers in {@link #MATCHERS}.
 */
public enum ErrorCategory {

    SOURCE_FORMAT_ERROR("Source format error", "Spreadsheet header or structure cannot be read"),
    SCHEMA_DRIFT_ERROR("Schema drift error", "Source columns cannot be reconciled with the target schema"),
    CONNECTION_ERROR("Database connection error", "Failed to establish or maintain database connection"),
    CONSTRAINT_VIOLATION("Database constraint violation", "Database constraint check failed"),
    SQL_SYNTAX_ERROR("SQL syntax error", "Invalid SQL syntax or semantic error"),
    TRANSACTION_ROLLBACK("Transaction rollback", "Transaction was rolled back"),
    SCHEMA_MISMATCH("Schema mismatch", "Destination table lacks columns required by the target schema"),
    PARTIAL_LOAD("Partial load", "Load aborted after some batches were committed"),
    DATABASE_ERROR("Database error", "General database operation error"),
    NETWORK_ERROR("Network error", "Network communication failure"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    VALIDATION_ERROR("Validation error", "Input validation or business rule violation"),
    CONFIGURATION_ERROR("Configuration error", "Backend or application configuration issue"),
    RESOURCE_ERROR("Resource error", "File missing or system resource unavailable"),
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
        MATCHERS.put(ErrorCategory::isResourceError, RESOURCE_ERROR);
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        if (exception instanceof IngestionException ingestion) {
            return ingestion.getCategory();
        }
        if (exception instanceof SQLException sqlEx) {
            return categorizeSqlException(sqlEx);
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    private static ErrorCategory categorizeSqlException(SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null) {
            ErrorCategory byState = SQL_STATE_PREFIX.get(sqlState.substring(0, Math.min(2, sqlState.length())));
            if (byState != null) {
                return byState;
            }
        }
        String msg = sqlEx.getMessage();
        if (msg != null) {
            String lower = msg.toLowerCase();
            if (containsAny(lower, "connection", "timeout", "refused", "closed")) return CONNECTION_ERROR;
            if (containsAny(lower, "constraint", "unique", "foreign key", "duplicate")) return CONSTRAINT_VIOLATION;
            if (containsAny(lower, "syntax", "parse error", "unknown column")) return SQL_SYNTAX_ERROR;
        }
        return DATABASE_ERROR;
    }

    private static final Map<String, ErrorCategory> SQL_STATE_PREFIX = Map.of(
            "08", CONNECTION_ERROR,
            "23", CONSTRAINT_VIOLATION,
            "42", SQL_SYNTAX_ERROR,
            "40", TRANSACTION_ROLLBACK,
            "22", VALIDATION_ERROR
    );

    // --- Matcher helpers ---

    private static boolean isResourceError(Throwable t) {
        return t instanceof java.io.FileNotFoundException
                || t instanceof java.nio.file.NoSuchFileException
                || t instanceof java.nio.file.AccessDeniedException
                || t instanceof OutOfMemoryError;
    }

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.SocketTimeoutException
                || t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException;
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || (t.getMessage() != null && t.getMessage().toLowerCase().contains("timed out"));
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof jakarta.validation.ConstraintViolationException
                || t instanceof IndexOutOfBoundsException;
    }

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof org.springframework.beans.factory.BeanCreationException
                || t instanceof org.springframework.boot.context.properties.bind.BindException;
    }

    private static boolean containsAny(String text, String... keywords) {
        if (text == null) return false;
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
