package com.di.sheetload.config;

/**
 * What happens to rows already in the destination table.
 */
public enum WriteMode {
    /** Keep existing rows and add the new ones. */
    APPEND,
    /** Delete all existing rows (in their own transaction) before the first batch. */
    REPLACE
}
