package com.di.sheetload.load;

import com.di.sheetload.backend.BackendConfig;
import com.di.sheetload.backend.BackendDataSources;
import com.di.sheetload.backend.DbConfigSnapshot;
import com.di.sheetload.config.WriteMode;
import com.di.sheetload.exception.BackendConnectionException;
import com.di.sheetload.exception.PartialLoadException;
import com.di.sheetload.exception.SchemaMismatchException;
import com.di.sheetload.reconcile.ReconciledRow;
import com.di.sheetload.schema.FieldSpec;
import com.di.sheetload.schema.TargetSchema;
import com.di.sheetload.util.InputValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes reconciled rows into the destination table, one transaction per batch.
 *
 * <p>Order of work: connect, check the live column set covers the target schema (nothing is sent
 * otherwise), optionally clear the table, then insert. A failed batch is rolled back and the run
 * stops with {@link PartialLoadException}; batches committed before it stay. The loader never
 * issues DDL and is the only component that writes to the backend.
 */
@Slf4j
@Component
public class BatchLoader {

    private static final int VALIDATION_TIMEOUT_SECONDS = 5;

    public LoadResult load(BackendConfig backend, DbConfigSnapshot snapshot, TargetSchema schema,
                           Iterator<ReconciledRow> rows, LoadSettings settings) {
        DataSource dataSource;
        try {
            dataSource = BackendDataSources.INSTANCE.getOrInit(snapshot);
        } catch (RuntimeException e) {
            throw new BackendConnectionException("Cannot create connection pool for " + backend.describe()
                    + ": " + e.getMessage(), e);
        }

        try (Connection connection = open(dataSource, backend)) {
            TableColumns columns = TableColumns.read(connection.getMetaData(), connection.getCatalog(), settings.table());
            List<String> warnings = new ArrayList<>();
            checkSchema(columns, schema, settings);
            String runIdColumn = resolveRunIdColumn(columns, settings, warnings);

            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try {
                long deleted = settings.writeMode() == WriteMode.REPLACE ? clearTable(connection, columns) : 0L;
                long baseline = count(connection, columns);
                log.info("[LOAD] {} | table={} | baseline rows={} | batchSize={} | mode={}",
                        backend.describe(), columns.quotedTable(), baseline, settings.batchSize(), settings.writeMode());

                LoadResult.LoadResultBuilder result = LoadResult.builder()
                        .baselineCount(baseline)
                        .rowsDeleted(deleted)
                        .columns(columns)
                        .runIdColumn(runIdColumn)
                        .warnings(List.copyOf(warnings));
                BatchTally tally = new BatchTally();
                try {
                    insert(connection, columns, schema, rows, settings, runIdColumn, tally);
                } catch (PartialLoadException e) {
                    throw e.withPartialResult(result
                            .rowsLoaded(tally.rowsLoaded)
                            .batchesCommitted(tally.batchesCommitted)
                            .build());
                }
                BackendDataSources.INSTANCE.logPoolStats(snapshot, "after load");
                return result
                        .rowsLoaded(tally.rowsLoaded)
                        .batchesCommitted(tally.batchesCommitted)
                        .build();
            } finally {
                restoreAutoCommit(connection, autoCommit);
            }
        } catch (SQLException e) {
            throw new BackendConnectionException("Backend error before loading "
                    + InputValidator.sanitizeForLogging(settings.table()) + ": " + e.getMessage(), e);
        }
    }

    private Connection open(DataSource dataSource, BackendConfig backend) {
        try {
            Connection connection = dataSource.getConnection();
            if (!connection.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                connection.close();
                throw new BackendConnectionException("Connection to " + backend.describe() + " is not valid", null);
            }
            return connection;
        } catch (SQLException e) {
            log.error("[LOAD] Cannot connect to {}: {}", backend.describe(), e.getMessage());
            throw new BackendConnectionException("Cannot connect to " + backend.describe() + ": " + e.getMessage(), e);
        }
    }

    private void checkSchema(TableColumns columns, TargetSchema schema, LoadSettings settings) {
        List<String> missing = schema.getFields().stream()
                .map(FieldSpec::name)
                .filter(name -> !columns.contains(name))
                .collect(Collectors.toList());
        if (!columns.exists()) {
            log.error("[LOAD] Table {} does not exist; all {} target columns are missing", settings.table(), missing.size());
            throw new SchemaMismatchException(settings.table(), missing);
        }
        if (!missing.isEmpty()) {
            log.error("[LOAD] Table {} lacks {} target column(s): {}", settings.table(), missing.size(), missing);
            throw new SchemaMismatchException(settings.table(), missing);
        }
        log.debug("[LOAD] Table {} has all {} target columns ({} live columns)",
                columns.quotedTable(), schema.size(), columns.size());
    }

    private String resolveRunIdColumn(TableColumns columns, LoadSettings settings, List<String> warnings) {
        if (settings.runIdColumn() == null) {
            return null;
        }
        if (!columns.contains(settings.runIdColumn())) {
            String warning = String.format("run-id column '%s' is not in table %s; verifying by table growth",
                    settings.runIdColumn(), settings.table());
            log.warn("[LOAD] {}", warning);
            warnings.add(warning);
            return null;
        }
        return settings.runIdColumn();
    }

    private long clearTable(Connection connection, TableColumns columns) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            int deleted = statement.executeUpdate("DELETE FROM " + columns.quotedTable());
            connection.commit();
            log.info("[LOAD] Cleared {} existing row(s) from {}", deleted, columns.quotedTable());
            return deleted;
        } catch (SQLException e) {
            rollbackQuietly(connection);
            throw e;
        }
    }

    private long count(Connection connection, TableColumns columns) throws SQLException {
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM " + columns.quotedTable())) {
            long result = rs.next() ? rs.getLong(1) : 0L;
            connection.commit();
            return result;
        }
    }

    private void insert(Connection connection, TableColumns columns, TargetSchema schema,
                        Iterator<ReconciledRow> rows, LoadSettings settings, String runIdColumn, BatchTally tally) {
        List<TableColumns.Column> bindColumns = new ArrayList<>();
        for (FieldSpec field : schema.getFields()) {
            bindColumns.add(columns.find(field.name()).orElseThrow());
        }
        TableColumns.Column runColumn = runIdColumn == null ? null : columns.find(runIdColumn).orElseThrow();

        List<String> names = schema.getFields().stream().map(f -> columns.quotedColumn(f.name())).collect(Collectors.toList());
        if (runColumn != null) {
            names.add(columns.quotedColumn(runIdColumn));
        }
        String sql = "INSERT INTO " + columns.quotedTable() + " (" + String.join(", ", names) + ") VALUES ("
                + names.stream().map(n -> "?").collect(Collectors.joining(", ")) + ")";

        int batchIndex = 0;
        int inBatch = 0;
        int firstRowOfBatch = -1;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            while (rows.hasNext()) {
                ReconciledRow row = rows.next();
                if (inBatch == 0) {
                    firstRowOfBatch = row.rowNumber();
                }
                for (int i = 0; i < bindColumns.size(); i++) {
                    bind(statement, i + 1, bindColumns.get(i), row.value(i));
                }
                if (runColumn != null) {
                    bind(statement, bindColumns.size() + 1, runColumn, settings.runId());
                }
                statement.addBatch();
                inBatch++;
                if (inBatch == settings.batchSize()) {
                    commitBatch(connection, statement, tally, inBatch, batchIndex, firstRowOfBatch);
                    batchIndex++;
                    inBatch = 0;
                }
            }
            if (inBatch > 0) {
                commitBatch(connection, statement, tally, inBatch, batchIndex, firstRowOfBatch);
            }
        } catch (SQLException | RuntimeException e) {
            rollbackQuietly(connection);
            log.error("[LOAD] Batch {} (from sheet row {}) failed after {} committed batch(es), {} row(s): {}",
                    batchIndex, firstRowOfBatch, tally.batchesCommitted, tally.rowsLoaded, e.getMessage());
            throw new PartialLoadException(batchIndex, tally.batchesCommitted, tally.rowsLoaded, e);
        }
        log.info("[LOAD] Inserted {} row(s) in {} batch(es) into {}", tally.rowsLoaded, tally.batchesCommitted,
                columns.quotedTable());
    }

    private void commitBatch(Connection connection, PreparedStatement statement, BatchTally tally,
                             int size, int batchIndex, int firstRow) throws SQLException {
        statement.executeBatch();
        connection.commit();
        tally.batchesCommitted++;
        tally.rowsLoaded += size;
        log.debug("[LOAD] Committed batch {} ({} rows from sheet row {})", batchIndex, size, firstRow);
    }

    static void bind(PreparedStatement statement, int index, TableColumns.Column column, Object value) throws SQLException {
        if (value == null) {
            statement.setNull(index, column.jdbcType());
        } else if (column.isCharacter()) {
            statement.setString(index, value instanceof BigDecimal decimal ? decimal.toPlainString() : value.toString());
        } else {
            statement.setObject(index, value, column.jdbcType());
        }
    }

    private void rollbackQuietly(Connection connection) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.warn("[LOAD] Rollback failed: {}", e.getMessage());
        }
    }

    private void restoreAutoCommit(Connection connection, boolean autoCommit) {
        try {
            connection.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            log.warn("[LOAD] Could not restore auto-commit: {}", e.getMessage());
        }
    }

    private static final class BatchTally {
        long rowsLoaded;
        int batchesCommitted;
    }
}
