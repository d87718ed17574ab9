package com.di.sheetload.source;

import java.util.List;

/**
 * One non-blank data row as delivered, before any reconciliation.
 *
 * @param rowNumber 1-based row number in the sheet (or the line a record starts on in a CSV file)
 * @param cells     raw cell text by column position; positions beyond the list are empty
 */
public record SourceRow(int rowNumber, List<String> cells) {

    public SourceRow {
        cells = List.copyOf(cells);
    }

    /** Cell text at the given position, or null when the row is shorter. */
    public String cell(int position) {
        return position >= 0 && position < cells.size() ? cells.get(position) : null;
    }
}
