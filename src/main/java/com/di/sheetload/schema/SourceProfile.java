package com.di.sheetload.schema;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Structural fingerprint of one source delivery. Built per run, never mutated.
 */
@Value
@Builder
public class SourceProfile {
    /** File name (or path) the profile was taken from. */
    String sourceName;
    /** Sheet the header and rows were read from; null for CSV. */
    String sheetName;
    /** Number of header columns, including blank ones. */
    int columnCount;
    /** Header labels by position after duplicate disambiguation; blank headers are empty strings. */
    List<String> headers;
    /** Disambiguated header label to 0-based column position; blank headers are not addressable. */
    Map<String, Integer> columnPositions;
    /** Fraction of data rows whose cell is null (blank or a null token), by column position. */
    Map<Integer, Double> nullDensity;
    /** Number of non-blank data rows. */
    int rowCount;

    public Optional<Integer> positionOf(String header) {
        return Optional.ofNullable(columnPositions.get(header));
    }

    public String headerAt(int position) {
        return position >= 0 && position < headers.size() ? headers.get(position) : "";
    }
}
