package com.di.sheetload.report;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of {@code profile(path)}: the structural fingerprint of a delivery.
 */
@Value
@Builder
public class ProfileReport {
    String sourceName;
    String sheetName;
    int headerRowNumber;
    int columnCount;
    int rowCount;
    List<ColumnProfile> columns;

    /**
     * @param position    0-based column position
     * @param header      disambiguated header label, empty when blank
     * @param nullDensity fraction of data rows with no value in this column
     */
    public record ColumnProfile(int position, String header, double nullDensity) {
    }
}
