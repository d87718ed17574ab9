package com.di.sheetload.schema;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * A source column located by name rather than position, because its identity is stable across
 * deliveries while its index is not.
 *
 * @param name     logical anchor name referenced by filter predicates
 * @param aliases  header labels the anchor may appear under; matched case-insensitively
 * @param required whether reconciliation fails when no alias is found in the header
 */
public record AnchorColumn(String name, List<String> aliases, boolean required) {

    public AnchorColumn {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Anchor name cannot be null or empty");
        }
        name = name.trim();
        aliases = aliases == null || aliases.isEmpty() ? List.of(name) : List.copyOf(aliases);
    }

    /** Lower-cased, trimmed alias set used for header matching. */
    public Set<String> normalizedAliases() {
        Set<String> normalized = new LinkedHashSet<>();
        for (String alias : aliases) {
            if (alias != null && !alias.isBlank()) {
                normalized.add(alias.trim().toLowerCase(Locale.ROOT));
            }
        }
        return normalized;
    }

    public boolean matches(String header) {
        return header != null && normalizedAliases().contains(header.trim().toLowerCase(Locale.ROOT));
    }
}
