package com.di.sheetload.source;

import com.di.sheetload.exception.MalformedSourceException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads UTF-8 CSV exports with Apache Commons CSV. The header is taken from the record at the
 * configured header row rather than through {@code setHeader()}, because delivered headers may
 * repeat and Commons CSV rejects duplicate header names.
 * <p>
 * Row numbers are the 1-based file line on which a record starts, so blank lines and cells
 * spanning several lines are counted the way an editor shows them.
 */
@Slf4j
@Component
public class CsvSourceReader implements SourceReader {

    private static final char BOM = '\uFEFF';

    /** Empty lines are kept as records so that line numbers can be counted; cells are trimmed in {@link #cells}. */
    private final CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
            .setIgnoreEmptyLines(false)
            .build();

    @Override
    public Set<String> extensions() {
        return Set.of("csv");
    }

    @Override
    public SourceSheet read(Path path, ReadOptions options) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = csvFormat.parse(reader)) {

            List<String> header = null;
            int headerRecordNumber = options.headerRow() + 1;
            List<SourceRow> rows = new ArrayList<>();
            int recordIndex = 0;
            int linesConsumed = 0;
            for (CSVRecord record : parser) {
                int lineNumber = linesConsumed + 1;
                linesConsumed += 1 + embeddedLineBreaks(record);
                if (recordIndex == options.headerRow()) {
                    header = ExcelSourceReader.trimTrailingBlanks(cells(record, recordIndex == 0));
                    headerRecordNumber = lineNumber;
                } else if (recordIndex > options.headerRow()) {
                    List<String> cells = cells(record, false);
                    if (cells.stream().anyMatch(c -> !c.isEmpty())) {
                        rows.add(new SourceRow(lineNumber, cells));
                    }
                }
                recordIndex++;
            }

            if (header == null || header.isEmpty()) {
                throw new MalformedSourceException("No header found in " + path.getFileName(), headerRecordNumber);
            }
            log.info("[PROFILE] Read CSV {} | headerRow={} | columns={} | dataRows={}",
                    path.getFileName(), headerRecordNumber, header.size(), rows.size());
            return new SourceSheet(path.getFileName().toString(), null, headerRecordNumber, header, rows);
        } catch (IOException | UncheckedIOException e) {
            throw new MalformedSourceException("Cannot read CSV " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private List<String> cells(CSVRecord record, boolean first) {
        List<String> cells = new ArrayList<>(record.size());
        for (int i = 0; i < record.size(); i++) {
            String value = record.get(i);
            if (value == null) {
                cells.add("");
                continue;
            }
            if (first && i == 0 && !value.isEmpty() && value.charAt(0) == BOM) {
                value = value.substring(1);
            }
            cells.add(value.trim());
        }
        return cells;
    }

    /** Line breaks inside quoted cells; a record spans this many lines beyond its first. */
    static int embeddedLineBreaks(CSVRecord record) {
        int breaks = 0;
        for (String value : record) {
            if (value == null) {
                continue;
            }
            for (int i = 0; i < value.length(); i++) {
                char c = value.charAt(i);
                if (c == '\n' || (c == '\r' && (i + 1 == value.length() || value.charAt(i + 1) != '\n'))) {
                    breaks++;
                }
            }
        }
        return breaks;
    }
}
