package com.di.sheetload.exception;

/**
 * The resolved backend cannot be reached. Fatal for the run and never retried.
 */
public class BackendConnectionException extends IngestionException {

    public BackendConnectionException(String message, Throwable cause) {
        super(ErrorCategory.CONNECTION_ERROR, message, null, cause);
    }
}
