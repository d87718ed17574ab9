package com.di.sheetload.filter;

import com.di.sheetload.source.SourceRow;

/**
 * Verdict of the predicate chain for one source row. {@code reason} is null for eligible rows.
 */
public record FilterOutcome(SourceRow row, boolean eligible, String reason) {

    public static final String MISSING_ANCHOR_VALUE = "missing-anchor-value";

    static FilterOutcome pass(SourceRow row) {
        return new FilterOutcome(row, true, null);
    }

    static FilterOutcome reject(SourceRow row, String reason) {
        return new FilterOutcome(row, false, reason);
    }

    public int rowNumber() {
        return row.rowNumber();
    }
}
