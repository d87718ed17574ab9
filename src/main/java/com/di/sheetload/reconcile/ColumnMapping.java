package com.di.sheetload.reconcile;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of reconciliation: for every target field, the source column it is read from.
 */
@Value
@Builder
public class ColumnMapping {

    /** Marker for a target field with no source counterpart. */
    public static final int ABSENT = -1;

    /** Source column position per target field index; {@link #ABSENT} when missing. */
    List<Integer> sourceIndexByTarget;
    /** Anchor name to source column position, for the anchors that were located. */
    Map<String, Integer> anchorPositions;
    /** Source columns that feed no target field, position to header label. */
    Map<Integer, String> ignoredColumns;
    /** Nullable target fields that are absent from this delivery. */
    List<String> absentFields;
    int matchedByName;
    int matchedByPosition;

    public int sourceIndexOf(int targetIndex) {
        return sourceIndexByTarget.get(targetIndex);
    }

    public Optional<Integer> anchorPosition(String anchor) {
        return Optional.ofNullable(anchorPositions.get(anchor));
    }

    /** True when target field {@code i} is read from source column {@code i} for every mapped field. */
    public boolean isPositionalIdentity() {
        for (int i = 0; i < sourceIndexByTarget.size(); i++) {
            int source = sourceIndexByTarget.get(i);
            if (source != ABSENT && source != i) {
                return false;
            }
        }
        return true;
    }
}
