package com.di.sheetload.backend;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Database engines a backend can be built for from URL parts. {@link #GENERIC} covers
 * {@code jdbc:} URLs supplied verbatim; the driver is then found by {@link java.sql.DriverManager}.
 */
public enum BackendEngine {

    MYSQL("jdbc:mysql", 3306, "com.mysql.cj.jdbc.Driver",
            Map.of("characterEncoding", "UTF-8", "rewriteBatchedStatements", "true")),
    POSTGRESQL("jdbc:postgresql", 5432, "org.postgresql.Driver", Map.of()),
    GENERIC(null, -1, null, Map.of());

    private final String jdbcPrefix;
    private final int defaultPort;
    private final String driverClassName;
    private final Map<String, String> defaultParams;

    BackendEngine(String jdbcPrefix, int defaultPort, String driverClassName, Map<String, String> defaultParams) {
        this.jdbcPrefix = jdbcPrefix;
        this.defaultPort = defaultPort;
        this.driverClassName = driverClassName;
        this.defaultParams = defaultParams;
    }

    public int getDefaultPort() {
        return defaultPort;
    }

    public String getDriverClassName() {
        return driverClassName;
    }

    /**
     * Maps a URL scheme to an engine: {@code mysql}, {@code mysql2}, {@code postgres}, {@code postgresql}.
     *
     * @throws IllegalArgumentException for any other scheme
     */
    public static BackendEngine fromScheme(String scheme) {
        String normalized = scheme == null ? "" : scheme.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "mysql":
            case "mysql2":
                return MYSQL;
            case "postgres":
            case "postgresql":
                return POSTGRESQL;
            default:
                throw new IllegalArgumentException("Unsupported database scheme: '" + scheme + "'");
        }
    }

    /**
     * Builds the JDBC URL for host/port/database; explicit params override the engine defaults.
     */
    public String jdbcUrl(String host, int port, String database, Map<String, String> params) {
        if (this == GENERIC) {
            throw new IllegalStateException("GENERIC backends carry a verbatim JDBC URL");
        }
        Map<String, String> merged = new LinkedHashMap<>(defaultParams);
        if (params != null) {
            merged.putAll(params);
        }
        String query = merged.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("&"));
        return String.format("%s://%s:%d/%s%s", jdbcPrefix, host, port, database, query.isEmpty() ? "" : "?" + query);
    }
}
