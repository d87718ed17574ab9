package com.di.sheetload.exception;

/**
 * The ambient backend configuration is internally inconsistent and no backend can be chosen.
 */
public class BackendUnresolvedException extends IngestionException {

    public BackendUnresolvedException(String message) {
        super(ErrorCategory.CONFIGURATION_ERROR, message, null);
    }

    public BackendUnresolvedException(String message, Throwable cause) {
        super(ErrorCategory.CONFIGURATION_ERROR, message, null, cause);
    }
}
