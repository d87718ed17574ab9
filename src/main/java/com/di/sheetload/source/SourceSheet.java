package com.di.sheetload.source;

import lombok.Value;

import java.util.List;

/**
 * A spreadsheet read into memory: the raw header row and the non-blank data rows below it.
 */
@Value
public class SourceSheet {
    String sourceName;
    /** Sheet name for workbooks, null for CSV files. */
    String sheetName;
    /** 1-based sheet row number of the header. */
    int headerRowNumber;
    /** Header labels as delivered, trimmed; duplicates are not yet disambiguated. */
    List<String> rawHeader;
    List<SourceRow> rows;
}
