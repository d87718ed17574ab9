package com.di.sheetload.exception;

/**
 * Name matching and positional fallback disagree about where a target field lives, which means a
 * column was inserted or moved inside the stable prefix of the sheet.
 */
public class PositionalDriftException extends IngestionException {

    private final String field;
    private final int expectedPosition;
    private final int observedPosition;

    public PositionalDriftException(String field, int expectedPosition, int observedPosition, String detail) {
        super(ErrorCategory.SCHEMA_DRIFT_ERROR,
                String.format("Target field '%s' expected at column %d but %s", field, expectedPosition, detail),
                column(observedPosition));
        this.field = field;
        this.expectedPosition = expectedPosition;
        this.observedPosition = observedPosition;
    }

    public String getField() {
        return field;
    }

    public int getExpectedPosition() {
        return expectedPosition;
    }

    public int getObservedPosition() {
        return observedPosition;
    }
}
