package com.di.sheetload.load;

import com.di.sheetload.config.WriteMode;
import com.di.sheetload.util.InputValidator;

/**
 * Per-run loader parameters.
 *
 * @param table       destination table, optionally schema-qualified
 * @param batchSize   rows per transaction
 * @param writeMode   whether existing rows are deleted first
 * @param runIdColumn optional isolation column; blank for none
 * @param runId       value written to the isolation column
 */
public record LoadSettings(String table, int batchSize, WriteMode writeMode, String runIdColumn, String runId) {

    public LoadSettings {
        table = InputValidator.validateTableName(table);
        InputValidator.validateBatchSize(batchSize);
        writeMode = writeMode == null ? WriteMode.APPEND : writeMode;
        runIdColumn = runIdColumn == null || runIdColumn.isBlank() ? null : InputValidator.validateColumnName(runIdColumn);
    }
}
