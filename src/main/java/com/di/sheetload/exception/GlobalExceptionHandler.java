package com.di.sheetload.exception;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps ingestion failures to HTTP statuses and a structured error body.
 *
 * <ul>
 *   <li>malformed source, anchor not found, too narrow, positional drift: 422</li>
 *   <li>backend unresolved, invalid request: 400</li>
 *   <li>backend connection: 503</li>
 *   <li>schema mismatch: 409</li>
 *   <li>partial load: 500, with the partial load report under {@code details.report}</li>
 * </ul>
 *
 * <p>To handle a further exception type:
 * <pre>{@code
 * @ExceptionHandler(YourException.class)
 * public ResponseEntity<ErrorResponse> handleYourException(YourException e) {
 *     return respond("YOUR_EXCEPTION", e, HttpStatus.BAD_REQUEST);
 * }
 * }</pre>
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({MalformedSourceException.class, AnchorNotFoundException.class,
            SchemaTooNarrowException.class, PositionalDriftException.class})
    public ResponseEntity<ErrorResponse> handleStructuralException(IngestionException e) {
        return respond("STRUCTURAL_EXCEPTION", e, HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @ExceptionHandler(BackendUnresolvedException.class)
    public ResponseEntity<ErrorResponse> handleUnresolvedBackend(BackendUnresolvedException e) {
        return respond("BACKEND_UNRESOLVED", e, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(BackendConnectionException.class)
    public ResponseEntity<ErrorResponse> handleConnectionException(BackendConnectionException e) {
        return respond("CONNECTION_EXCEPTION", e, HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(SchemaMismatchException.class)
    public ResponseEntity<ErrorResponse> handleSchemaMismatch(SchemaMismatchException e) {
        ResponseEntity<ErrorResponse> response = respond("SCHEMA_MISMATCH", e, HttpStatus.CONFLICT);
        response.getBody().addDetail("missingColumns", e.getMissingColumns());
        return response;
    }

    /**
     * Batches committed before the failure stay persisted, so the body carries the partial report.
     */
    @ExceptionHandler(PartialLoadException.class)
    public ResponseEntity<ErrorResponse> handlePartialLoad(PartialLoadException e) {
        ResponseEntity<ErrorResponse> response = respond("PARTIAL_LOAD", e, HttpStatus.INTERNAL_SERVER_ERROR);
        ErrorResponse body = response.getBody();
        body.addDetail("failedBatchIndex", e.getFailedBatchIndex());
        body.addDetail("batchesCommitted", e.getBatchesCommitted());
        body.addDetail("rowsLoaded", e.getRowsLoaded());
        if (e.getReport() != null) {
            body.addDetail("report", e.getReport());
        }
        return response;
    }

    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleValidationException(Exception e) {
        return respond("VALIDATION_EXCEPTION", e, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(SQLException.class)
    public ResponseEntity<ErrorResponse> handleSqlException(SQLException e) {
        ResponseEntity<ErrorResponse> response = respond("SQL_EXCEPTION", e, HttpStatus.INTERNAL_SERVER_ERROR);
        response.getBody().addDetail("sqlState", e.getSQLState());
        response.getBody().addDetail("errorCode", e.getErrorCode());
        return response;
    }

    /**
     * Catch-all.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        return respond("UNHANDLED_EXCEPTION", e, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> respond(String eventType, Throwable exception, HttpStatus status) {
        ErrorCategory category = ErrorCategory.categorize(exception);
        logError(eventType, category, exception, status);
        return ResponseEntity.status(status).body(buildErrorResponse(category, exception, status));
    }

    private void logError(String eventType, ErrorCategory category, Throwable exception, HttpStatus status) {
        Throwable rootCause = getRootCause(exception);
        String root = rootCause != exception
                ? " | rootCause=" + rootCause.getClass().getSimpleName() + ": " + rootCause.getMessage()
                : "";
        // Only 5xx responses log a stack trace.
        if (status.is5xxServerError()) {
            log.error("{} [{}] {} -> {}{}", eventType, category.getName(), exception.getMessage(), status.value(), root,
                    exception);
        } else {
            log.warn("{} [{}] {} -> {}{}", eventType, category.getName(), exception.getMessage(), status.value(), root);
        }
    }

    static ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setErrorCategoryDescription(category.getDescription());
        response.setPath(getRequestPath());

        response.addDetail("exceptionType", exception.getClass().getName());
        if (exception instanceof IngestionException ingestion) {
            ingestion.getLocation().ifPresent(location -> response.addDetail("location", location));
        }
        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        return response;
    }

    private static Throwable getRootCause(Throwable exception) {
        Throwable cause = exception.getCause();
        if (cause == null || cause == exception) {
            return exception;
        }
        return getRootCause(cause);
    }

    private static String getRequestPath() {
        String path = MDC.get("requestPath");
        return path != null ? path : "/unknown";
    }

    /**
     * Structured error response for API endpoints.
     */
    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private String errorCategoryDescription;
        private String path;
        private Map<String, Object> details = new LinkedHashMap<>();

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
