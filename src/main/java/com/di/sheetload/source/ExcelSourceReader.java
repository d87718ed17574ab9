package com.di.sheetload.source;

import com.di.sheetload.exception.MalformedSourceException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads .xlsx and .xls workbooks with Apache POI. Cells are rendered with {@link DataFormatter}
 * so numbers and dates come out the way the sheet displays them; formulas are evaluated.
 * Formatting uses a fixed US locale so decimals keep a '.' separator whatever the host locale.
 */
@Slf4j
@Component
public class ExcelSourceReader implements SourceReader {

    private final DataFormatter dataFormatter = new DataFormatter(Locale.US);

    @Override
    public Set<String> extensions() {
        return Set.of("xlsx", "xls");
    }

    @Override
    public SourceSheet read(Path path, ReadOptions options) {
        try (Workbook workbook = WorkbookFactory.create(path.toFile(), null, true)) {
            Sheet sheet = selectSheet(workbook, options.sheetName(), path);
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

            Row headerRow = sheet.getRow(options.headerRow());
            List<String> header = headerRow == null ? List.of() : trimTrailingBlanks(readCells(headerRow, evaluator));
            if (header.isEmpty()) {
                throw new MalformedSourceException(
                        String.format("No header found in sheet '%s' of %s", sheet.getSheetName(), path.getFileName()),
                        options.headerRow() + 1);
            }

            List<SourceRow> rows = new ArrayList<>();
            int lastRow = sheet.getLastRowNum();
            for (int rowIndex = options.headerRow() + 1; rowIndex <= lastRow; rowIndex++) {
                Row row = sheet.getRow(rowIndex);
                if (row == null) {
                    continue;
                }
                List<String> cells = readCells(row, evaluator);
                if (cells.stream().anyMatch(c -> !c.isEmpty())) {
                    rows.add(new SourceRow(rowIndex + 1, cells));
                }
            }

            log.info("[PROFILE] Read workbook {} | sheet={} | headerRow={} | columns={} | dataRows={}",
                    path.getFileName(), sheet.getSheetName(), options.headerRow() + 1, header.size(), rows.size());
            return new SourceSheet(path.getFileName().toString(), sheet.getSheetName(),
                    options.headerRow() + 1, header, rows);
        } catch (IOException | EncryptedDocumentException e) {
            throw new MalformedSourceException("Cannot read workbook " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private Sheet selectSheet(Workbook workbook, String sheetName, Path path) {
        if (sheetName != null && !sheetName.isBlank()) {
            Sheet sheet = workbook.getSheet(sheetName);
            if (sheet == null) {
                throw new MalformedSourceException(
                        String.format("Sheet '%s' not found in %s", sheetName, path.getFileName()));
            }
            return sheet;
        }
        if (workbook.getNumberOfSheets() == 0) {
            throw new MalformedSourceException("Workbook " + path.getFileName() + " has no sheets");
        }
        return workbook.getSheetAt(0);
    }

    private List<String> readCells(Row row, FormulaEvaluator evaluator) {
        int width = Math.max(row.getLastCellNum(), 0);
        List<String> cells = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
            Cell cell = row.getCell(i, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
            cells.add(cell == null ? "" : dataFormatter.formatCellValue(cell, evaluator).trim());
        }
        return cells;
    }

    static List<String> trimTrailingBlanks(List<String> cells) {
        int end = cells.size();
        while (end > 0 && SourceReader.isBlank(cells.get(end - 1))) {
            end--;
        }
        return List.copyOf(cells.subList(0, end));
    }
}
