package com.di.sheetload.report;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Result of {@code filter-preview(path)}: what a load would do, without touching the backend.
 */
@Value
@Builder
public class FilterPreviewReport {
    String sourceName;
    long rowsRead;
    long rowsEligible;
    long rowsFilteredOut;
    /** Eligible rows that would be rejected by cell coercion. */
    long rowsRejected;
    /** Number of excluded rows per reason. */
    Map<String, Long> reasonCounts;
    List<RejectedRow> rejectedRows;
}
