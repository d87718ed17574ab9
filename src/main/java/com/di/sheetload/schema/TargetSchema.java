package com.di.sheetload.schema;

import com.di.sheetload.util.InputValidator;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The fixed, ordered field list of the destination table.
 *
 * <p>Loaded once at start-up and shared by every run. The field order is the contract with the
 * backend: a reconciled row is always aligned 1:1 with {@link #getFields()}, however many columns
 * the source spreadsheet carries.
 */
public final class TargetSchema {

    private final List<FieldSpec> fields;
    private final Map<String, Integer> indexByHeader;
    private final Map<String, Integer> indexByHeaderIgnoreCase;
    private final Set<String> ambiguousIgnoreCase;

    public TargetSchema(List<FieldSpec> fields) {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("Target schema must declare at least one field");
        }
        this.fields = List.copyOf(fields);
        this.indexByHeader = new HashMap<>();
        this.indexByHeaderIgnoreCase = new HashMap<>();
        this.ambiguousIgnoreCase = new HashSet<>();

        Set<String> names = new HashSet<>();
        for (int i = 0; i < this.fields.size(); i++) {
            FieldSpec field = this.fields.get(i);
            InputValidator.validateColumnName(field.name());
            if (!names.add(field.name().toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("Duplicate target field name: " + field.name());
            }
            if (indexByHeader.putIfAbsent(field.header(), i) != null) {
                throw new IllegalArgumentException("Duplicate target header label: " + field.header());
            }
            String folded = field.header().toLowerCase(Locale.ROOT);
            if (indexByHeaderIgnoreCase.putIfAbsent(folded, i) != null) {
                ambiguousIgnoreCase.add(folded);
            }
        }
        ambiguousIgnoreCase.forEach(indexByHeaderIgnoreCase::remove);
    }

    /**
     * Validates that the schema has exactly the expected number of fields.
     *
     * @param expected expected field count, or a non-positive value to skip the check
     * @return this schema
     */
    public TargetSchema requireFieldCount(int expected) {
        if (expected > 0 && fields.size() != expected) {
            throw new IllegalStateException(String.format(
                    "Target schema declares %d fields but the destination contract requires %d",
                    fields.size(), expected));
        }
        return this;
    }

    public List<FieldSpec> getFields() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    public FieldSpec field(int index) {
        return fields.get(index);
    }

    /** Number of fields that must be present in every delivery. */
    public int requiredFieldCount() {
        return (int) fields.stream().filter(f -> !f.nullable()).count();
    }

    /**
     * Finds the target field delivered under the given header label. Exact match first; a
     * case-insensitive match is only used when it is unambiguous across the whole schema.
     */
    public Optional<Integer> indexOfHeader(String header) {
        if (header == null || header.isBlank()) {
            return Optional.empty();
        }
        String trimmed = header.trim();
        Integer exact = indexByHeader.get(trimmed);
        if (exact != null) {
            return Optional.of(exact);
        }
        return Optional.ofNullable(indexByHeaderIgnoreCase.get(trimmed.toLowerCase(Locale.ROOT)));
    }

    public List<String> fieldNames() {
        return fields.stream().map(FieldSpec::name).toList();
    }
}
