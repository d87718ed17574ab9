package com.di.sheetload.exception;

/**
 * The source cannot be read structurally: unsupported file type, missing header row, or duplicate
 * header labels that cannot be disambiguated.
 */
public class MalformedSourceException extends IngestionException {

    public MalformedSourceException(String message) {
        super(ErrorCategory.SOURCE_FORMAT_ERROR, message, null);
    }

    public MalformedSourceException(String message, int sheetRowNumber) {
        super(ErrorCategory.SOURCE_FORMAT_ERROR, message, sheetRow(sheetRowNumber));
    }

    public MalformedSourceException(String message, Throwable cause) {
        super(ErrorCategory.SOURCE_FORMAT_ERROR, message, null, cause);
    }
}
