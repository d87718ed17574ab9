package com.di.sheetload.reconcile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Values aligned 1:1 with the target field list, ready to bind. Null entries are SQL NULLs.
 *
 * @param rowNumber 1-based sheet row number the values came from
 * @param values    one value per target field: {@code String}, {@code Long}, {@code BigDecimal} or null
 */
public record ReconciledRow(int rowNumber, List<Object> values) {

    public ReconciledRow {
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public Object value(int targetIndex) {
        return values.get(targetIndex);
    }
}
