package com.di.sheetload.schema;

import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Cell values that mean "no value" in a delivery ("Notreported", "N/A", ...). Blank cells are
 * always null. Tokens are compared exactly after trimming.
 */
public final class NullTokens {

    private final Set<String> tokens;

    public NullTokens(Collection<String> tokens) {
        this.tokens = tokens == null ? Set.of() : tokens.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(String::trim)
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean isNull(String value) {
        return value == null || value.isBlank() || tokens.contains(value.trim());
    }

    public Set<String> getTokens() {
        return tokens;
    }
}
