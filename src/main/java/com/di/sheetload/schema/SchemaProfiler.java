package com.di.sheetload.schema;

import com.di.sheetload.exception.MalformedSourceException;
import com.di.sheetload.source.SourceRow;
import com.di.sheetload.source.SourceSheet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the structural fingerprint of a delivery: column count, header positions and per-column
 * null density. Read-only over the sheet.
 */
@Slf4j
@Component
public class SchemaProfiler {

    public SourceProfile profile(SourceSheet sheet, NullTokens nullTokens) {
        List<String> headers = disambiguate(sheet.getRawHeader(), sheet.getHeaderRowNumber());

        Map<String, Integer> positions = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            if (!headers.get(i).isEmpty()) {
                positions.put(headers.get(i), i);
            }
        }

        int columnCount = headers.size();
        long[] nullCounts = new long[columnCount];
        for (SourceRow row : sheet.getRows()) {
            for (int i = 0; i < columnCount; i++) {
                if (nullTokens.isNull(row.cell(i))) {
                    nullCounts[i]++;
                }
            }
        }
        int rowCount = sheet.getRows().size();
        Map<Integer, Double> nullDensity = new LinkedHashMap<>();
        for (int i = 0; i < columnCount; i++) {
            nullDensity.put(i, rowCount == 0 ? 0.0 : nullCounts[i] / (double) rowCount);
        }

        log.info("[PROFILE] {} | columns={} | rows={} | addressableHeaders={}",
                sheet.getSourceName(), columnCount, rowCount, positions.size());
        return SourceProfile.builder()
                .sourceName(sheet.getSourceName())
                .sheetName(sheet.getSheetName())
                .columnCount(columnCount)
                .headers(List.copyOf(headers))
                .columnPositions(Collections.unmodifiableMap(positions))
                .nullDensity(Collections.unmodifiableMap(nullDensity))
                .rowCount(rowCount)
                .build();
    }

    /**
     * Labels repeated headers the way the upstream export tooling does: the first occurrence keeps
     * its name, later ones become {@code name.1}, {@code name.2}, ... Blank headers stay blank.
     *
     * @throws MalformedSourceException when a generated label collides with another header
     */
    static List<String> disambiguate(List<String> rawHeader, int headerRowNumber) {
        Map<String, Integer> occurrences = new HashMap<>();
        List<String> result = new ArrayList<>(rawHeader.size());
        Set<String> taken = new HashSet<>();
        for (String raw : rawHeader) {
            String label = raw == null ? "" : raw.trim();
            if (!label.isEmpty()) {
                taken.add(label);
            }
        }
        Set<String> assigned = new HashSet<>();
        for (int i = 0; i < rawHeader.size(); i++) {
            String label = rawHeader.get(i) == null ? "" : rawHeader.get(i).trim();
            if (label.isEmpty()) {
                result.add("");
                continue;
            }
            int seen = occurrences.merge(label, 1, Integer::sum) - 1;
            if (seen == 0) {
                assigned.add(label);
                result.add(label);
                continue;
            }
            String candidate = label + "." + seen;
            if (taken.contains(candidate) || !assigned.add(candidate)) {
                throw new MalformedSourceException(String.format(
                        "Duplicate header '%s' at column %d cannot be disambiguated: '%s' is already present",
                        label, i, candidate), headerRowNumber);
            }
            result.add(candidate);
        }
        return result;
    }
}
