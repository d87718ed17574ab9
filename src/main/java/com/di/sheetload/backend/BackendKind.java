package com.di.sheetload.backend;

/**
 * Which configuration tier the backend was resolved from.
 */
public enum BackendKind {
    /** A single URL-style variable, as injected by a managed cloud database. */
    MANAGED_CLOUD,
    /** Discrete host/port/user/password/database variables. */
    EXPLICIT_ENV,
    /** Nothing configured; the documented local database. */
    LOCAL_DEFAULT
}
