package com.di.sheetload.report;

/**
 * Pipeline stage that excluded a row.
 */
public enum RejectionStage {
    /** Failed a filter predicate or had no value in a filtered anchor column. */
    FILTER,
    /** A cell could not be coerced to its field's semantic type. */
    COERCION
}
