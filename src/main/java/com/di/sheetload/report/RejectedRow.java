package com.di.sheetload.report;

/**
 * A source row excluded from the load.
 *
 * @param rowNumber 1-based sheet row number
 * @param reason    machine-readable reason, e.g. {@code missing-anchor-value} or {@code coercion-failed:Year}
 * @param stage     stage that excluded the row
 */
public record RejectedRow(int rowNumber, String reason, RejectionStage stage) {
}
