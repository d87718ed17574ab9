package com.di.sheetload.verify;

import com.di.sheetload.load.LoadResult;
import com.di.sheetload.load.TableColumns;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Re-queries the backend after a load (complete or partial) and compares the row count with the
 * loader's tally. Telemetry only: a mismatch or a failing query becomes a warning, never an
 * exception, because other processes may write the same table concurrently.
 */
@Slf4j
@Component
public class LoadVerifier {

    public VerificationResult verify(DataSource dataSource, LoadResult load, String runId,
                                     List<String> sampleColumns, int sampleSize) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        TableColumns columns = load.getColumns();
        boolean byRunId = load.getRunIdColumn() != null;
        String where = byRunId ? " WHERE " + columns.quotedColumn(load.getRunIdColumn()) + " = ?" : "";
        Object[] args = byRunId ? new Object[]{runId} : new Object[0];

        List<String> warnings = new ArrayList<>();
        long verified = -1L;
        try {
            Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + columns.quotedTable() + where,
                    Long.class, args);
            long total = count == null ? 0L : count;
            verified = byRunId ? total : total - load.getBaselineCount();
        } catch (DataAccessException e) {
            warnings.add("verification count failed: " + e.getMostSpecificCause().getMessage());
            log.warn("[VERIFY] Count query on {} failed: {}", columns.quotedTable(), e.getMostSpecificCause().getMessage());
        }

        boolean matched = verified == load.getRowsLoaded();
        String method = byRunId ? "RUN_ID" : "TABLE_GROWTH";
        if (verified >= 0 && !matched) {
            warnings.add(String.format("row count mismatch (%s): loader committed %d, backend reports %d",
                    method, load.getRowsLoaded(), verified));
        }
        log.info("[VERIFY] {}: expected={} verified={} -> {}", method, load.getRowsLoaded(), verified,
                matched ? "PASS" : "MISMATCH");

        return VerificationResult.builder()
                .method(method)
                .expectedRows(load.getRowsLoaded())
                .verifiedRows(verified)
                .matched(matched)
                .samples(sample(jdbcTemplate, columns, where, args, sampleColumns, sampleSize, warnings))
                .warnings(List.copyOf(warnings))
                .build();
    }

    private List<Map<String, Object>> sample(JdbcTemplate jdbcTemplate, TableColumns columns, String where,
                                             Object[] args, List<String> sampleColumns, int sampleSize,
                                             List<String> warnings) {
        List<String> present = sampleColumns.stream().filter(columns::contains).collect(Collectors.toList());
        if (sampleSize <= 0 || present.isEmpty()) {
            return List.of();
        }
        String select = present.stream().map(columns::quotedColumn).collect(Collectors.joining(", "));
        String sql = "SELECT " + select + " FROM " + columns.quotedTable() + where;
        try {
            jdbcTemplate.setMaxRows(sampleSize);
            return jdbcTemplate.queryForList(sql, args);
        } catch (DataAccessException e) {
            warnings.add("verification sample failed: " + e.getMostSpecificCause().getMessage());
            log.warn("[VERIFY] Sample query on {} failed: {}", columns.quotedTable(), e.getMostSpecificCause().getMessage());
            return List.of();
        }
    }
}
