package com.di.sheetload.schema;

/**
 * One field of the target schema.
 *
 * @param name     storage column name in the destination table
 * @param header   spreadsheet header label the field is delivered under (defaults to {@code name})
 * @param type     semantic type used for cell coercion (defaults to TEXT)
 * @param nullable whether the field may be missing from a delivery altogether
 */
public record FieldSpec(String name, String header, SemanticType type, boolean nullable) {

    public FieldSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Field name cannot be null or empty");
        }
        name = name.trim();
        header = header == null || header.isBlank() ? name : header.trim();
        type = type == null ? SemanticType.TEXT : type;
    }

    public static FieldSpec text(String name) {
        return new FieldSpec(name, name, SemanticType.TEXT, false);
    }
}
