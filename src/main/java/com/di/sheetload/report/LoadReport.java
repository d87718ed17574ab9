package com.di.sheetload.report;

import com.di.sheetload.backend.BackendKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Audit record of one load run, returned to the caller. The only artifact the pipeline produces
 * besides the rows themselves.
 */
@Value
@Builder
public class LoadReport {
    String runId;
    String sourceName;
    String table;
    BackendKind backendKind;
    /** Variable the backend was resolved from, or "local-default". */
    String backendOrigin;

    long rowsRead;
    long rowsFilteredOut;
    long rowsRejected;
    long rowsLoaded;
    int batchesCommitted;
    int batchSize;
    long rowsDeleted;

    /** RUN_ID or TABLE_GROWTH; null when the load never reached the backend's rows. */
    String verificationMethod;
    /** Rows the backend reports for this run; -1 when not verified. */
    long verifiedCount;
    List<RejectedRow> rejectedRows;
    List<String> warnings;
    List<Map<String, Object>> samples;

    Instant startedAt;
    Instant completedAt;

    /** Filter and coercion exclusions for the given stage. */
    public long rejectedAt(RejectionStage stage) {
        return rejectedRows.stream().filter(r -> r.stage() == stage).count();
    }
}
