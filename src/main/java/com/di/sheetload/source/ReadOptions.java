package com.di.sheetload.source;

/**
 * Where to find the header inside a source file.
 *
 * @param headerRow 0-based index of the header row; data rows follow it
 * @param sheetName sheet to read from a workbook; the first sheet when blank
 */
public record ReadOptions(int headerRow, String sheetName) {

    public ReadOptions {
        if (headerRow < 0) {
            throw new IllegalArgumentException("Header row must not be negative, got: " + headerRow);
        }
    }
}
