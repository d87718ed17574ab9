package com.di.sheetload.schema;

/**
 * How a spreadsheet cell is coerced before it is bound to its storage column.
 */
public enum SemanticType {
    /** Trimmed free text, truncated to the configured maximum length. */
    TEXT,
    /** Whole number; "2019" and "2019.0" are both accepted. */
    INTEGER,
    /** Plain decimal number. */
    DECIMAL,
    /** Decimal number with an optional trailing percent sign ("85%" becomes 85). */
    PERCENT
}
