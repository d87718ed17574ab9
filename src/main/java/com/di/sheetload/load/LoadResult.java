package com.di.sheetload.load;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * The loader's own tally of a completed run.
 */
@Value
@Builder
public class LoadResult {
    long rowsLoaded;
    int batchesCommitted;
    /** Rows in the table before the first batch (after a REPLACE delete). */
    long baselineCount;
    /** Rows removed by a REPLACE delete. */
    long rowsDeleted;
    /** Live column metadata, reused by the verifier. */
    TableColumns columns;
    /** Isolation column actually written, or null when the run is verified by table growth. */
    String runIdColumn;
    List<String> warnings;
}
