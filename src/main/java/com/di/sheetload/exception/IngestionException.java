package com.di.sheetload.exception;

import java.util.Optional;

/**
 * Base class of every terminal ingestion failure. A run that raises one of these stops; nothing
 * in the pipeline retries.
 *
 * <p>{@code location} points at the place in the source file or load sequence the failure is
 * attributable to ("sheet row 4", "column 73", "batch 2"), when there is one.
 */
public abstract class IngestionException extends RuntimeException {

    private final ErrorCategory category;
    private final String location;

    protected IngestionException(ErrorCategory category, String message, String location, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.location = location;
    }

    protected IngestionException(ErrorCategory category, String message, String location) {
        this(category, message, location, null);
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public Optional<String> getLocation() {
        return Optional.ofNullable(location);
    }

    static String sheetRow(int rowNumber) {
        return "sheet row " + rowNumber;
    }

    static String column(int position) {
        return "column " + position;
    }

    static String batch(int batchIndex) {
        return "batch " + batchIndex;
    }
}
