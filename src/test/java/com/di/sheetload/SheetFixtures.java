package com.di.sheetload;

import com.di.sheetload.schema.FieldSpec;
import com.di.sheetload.schema.SemanticType;
import com.di.sheetload.schema.TargetSchema;
import com.di.sheetload.source.SourceRow;
import com.di.sheetload.source.SourceSheet;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Shared builders for sheets, schemas and the 157-column delivery used across tests.
 */
public final class SheetFixtures {

    /** Scenario shape: 132 target fields, 25 appended columns, 6193 rows of which 5959 are SMD. */
    public static final int TARGET_FIELDS = 132;
    public static final int SOURCE_COLUMNS = 157;
    public static final int ANCHOR_POSITION = 73;
    public static final String ANCHOR_HEADER = "business-unit-code";
    public static final int TOTAL_ROWS = 6193;
    public static final int SMD_ROWS = 5959;

    private SheetFixtures() {
    }

    /** Text fields {@code f0..f(n-1)}, header equal to name, all required. */
    public static TargetSchema schema(int fieldCount) {
        List<FieldSpec> fields = new ArrayList<>();
        for (int i = 0; i < fieldCount; i++) {
            fields.add(FieldSpec.text("f" + i));
        }
        return new TargetSchema(fields);
    }

    public static List<String> headers(TargetSchema schema) {
        return schema.getFields().stream().map(FieldSpec::header).toList();
    }

    public static SourceSheet sheet(List<String> header, List<List<String>> rows) {
        List<SourceRow> sourceRows = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            sourceRows.add(new SourceRow(i + 2, rows.get(i)));
        }
        return new SourceSheet("test.xlsx", "Sheet1", 1, List.copyOf(header), sourceRows);
    }

    public static List<String> row(String... cells) {
        return Arrays.asList(cells);
    }

    // ------------------------------------------------------------------ //
    // 157-column scenario                                                  //
    // ------------------------------------------------------------------ //

    /**
     * Measurement schema stand-in: field 73 is the business unit, field 5 the publication year.
     */
    public static TargetSchema scenarioSchema() {
        List<FieldSpec> fields = new ArrayList<>();
        for (int i = 0; i < TARGET_FIELDS; i++) {
            if (i == ANCHOR_POSITION) {
                fields.add(new FieldSpec("business_unit_code", ANCHOR_HEADER, SemanticType.TEXT, false));
            } else if (i == 5) {
                fields.add(new FieldSpec("Year", "Year", SemanticType.INTEGER, false));
            } else {
                fields.add(new FieldSpec("col_" + i, "Column " + i, SemanticType.TEXT, false));
            }
        }
        return new TargetSchema(fields);
    }

    public static List<String> scenarioHeader() {
        List<String> header = new ArrayList<>(headers(scenarioSchema()));
        for (int i = TARGET_FIELDS; i < SOURCE_COLUMNS; i++) {
            header.add("Added " + i);
        }
        return header;
    }

    /** The 234 non-SMD rows come first: half carry another unit, half leave the anchor blank. */
    public static List<String> scenarioRow(int index) {
        List<String> cells = new ArrayList<>(SOURCE_COLUMNS);
        int nonSmd = TOTAL_ROWS - SMD_ROWS;
        for (int c = 0; c < SOURCE_COLUMNS; c++) {
            if (c == ANCHOR_POSITION) {
                cells.add(index >= nonSmd ? "SMD" : (index % 2 == 0 ? "GMD" : ""));
            } else if (c == 5) {
                cells.add(String.valueOf(2000 + index % 24));
            } else if (c == 7) {
                cells.add("Notreported");
            } else {
                cells.add("r" + index + "c" + c);
            }
        }
        return cells;
    }

    /** Writes the scenario as a CSV file with the header on the first record. */
    public static Path writeScenarioCsv(Path dir) throws IOException {
        Path file = dir.resolve("delivery-157.csv");
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT)) {
            printer.printRecord(scenarioHeader());
            for (int i = 0; i < TOTAL_ROWS; i++) {
                printer.printRecord(scenarioRow(i));
            }
        }
        return file;
    }
}
