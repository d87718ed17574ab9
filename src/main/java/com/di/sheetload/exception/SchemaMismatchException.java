package com.di.sheetload.exception;

import java.util.List;

/**
 * The destination table lacks columns the target schema writes. Raised before any row is sent;
 * the pipeline never alters the destination structure.
 */
public class SchemaMismatchException extends IngestionException {

    private final String table;
    private final List<String> missingColumns;

    public SchemaMismatchException(String table, List<String> missingColumns) {
        super(ErrorCategory.SCHEMA_MISMATCH,
                String.format("Table '%s' is missing %d required column(s): %s",
                        table, missingColumns.size(), missingColumns),
                null);
        this.table = table;
        this.missingColumns = List.copyOf(missingColumns);
    }

    public String getTable() {
        return table;
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
