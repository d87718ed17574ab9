package com.di.sheetload.exception;

/**
 * The source carries fewer columns than the target schema requires. Reconciliation never invents data.
 */
public class SchemaTooNarrowException extends IngestionException {

    private final int sourceColumns;
    private final int requiredFields;

    public SchemaTooNarrowException(int sourceColumns, int requiredFields, String detail) {
        super(ErrorCategory.SCHEMA_DRIFT_ERROR,
                String.format("Source has %d columns but the target schema requires %d%s",
                        sourceColumns, requiredFields, detail == null ? "" : ": " + detail),
                column(sourceColumns));
        this.sourceColumns = sourceColumns;
        this.requiredFields = requiredFields;
    }

    public int getSourceColumns() {
        return sourceColumns;
    }

    public int getRequiredFields() {
        return requiredFields;
    }
}
