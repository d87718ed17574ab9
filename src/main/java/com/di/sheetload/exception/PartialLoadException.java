package com.di.sheetload.exception;

import com.di.sheetload.load.LoadResult;
import com.di.sheetload.report.LoadReport;

/**
 * A batch failed mid-run. Batches committed before it stay persisted; the failing batch was rolled back.
 */
public class PartialLoadException extends IngestionException {

    private final int failedBatchIndex;
    private final int batchesCommitted;
    private final long rowsLoaded;
    private transient LoadResult partialResult;
    private transient LoadReport report;

    public PartialLoadException(int failedBatchIndex, int batchesCommitted, long rowsLoaded, Throwable cause) {
        super(ErrorCategory.PARTIAL_LOAD,
                String.format("Batch %d failed after %d batch(es) / %d row(s) were committed: %s",
                        failedBatchIndex, batchesCommitted, rowsLoaded,
                        cause != null ? cause.getMessage() : "unknown cause"),
                batch(failedBatchIndex), cause);
        this.failedBatchIndex = failedBatchIndex;
        this.batchesCommitted = batchesCommitted;
        this.rowsLoaded = rowsLoaded;
    }

    /** 0-based index of the first batch that did not commit. */
    public int getFailedBatchIndex() {
        return failedBatchIndex;
    }

    public int getBatchesCommitted() {
        return batchesCommitted;
    }

    public long getRowsLoaded() {
        return rowsLoaded;
    }

    /** Loader tally up to the failing batch, for verification of what was committed. */
    public LoadResult getPartialResult() {
        return partialResult;
    }

    public PartialLoadException withPartialResult(LoadResult partialResult) {
        this.partialResult = partialResult;
        return this;
    }

    /** Report of the partial run, attached once the verifier has looked at the committed batches. */
    public LoadReport getReport() {
        return report;
    }

    public PartialLoadException withReport(LoadReport report) {
        this.report = report;
        return this;
    }
}
