package com.di.sheetload.report;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Result of {@code reconcile(path)}: where every target field is read from.
 */
@Value
@Builder
public class ReconciliationReport {
    String sourceName;
    int sourceColumns;
    int targetFields;
    int matchedByName;
    int matchedByPosition;
    /** True when every mapped field sits at its own canonical position. */
    boolean positionalIdentity;
    Map<String, Integer> anchorPositions;
    List<String> absentFields;
    /** Source columns outside the target set, position to header label. */
    Map<Integer, String> ignoredColumns;
    List<FieldSource> fields;

    /**
     * @param sourcePosition -1 when the field is absent from this delivery
     */
    public record FieldSource(int targetIndex, String field, int sourcePosition, String sourceHeader) {
    }
}
