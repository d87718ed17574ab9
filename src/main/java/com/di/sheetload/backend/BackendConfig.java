package com.di.sheetload.backend;

import com.di.sheetload.config.BackendProperties;
import com.di.sheetload.util.InputValidator;

import java.util.Map;

/**
 * The backend a run writes to. Resolved once at the top of the run and passed down by parameter.
 *
 * @param kind     configuration tier it was resolved from
 * @param origin   variable (or "local-default") that decided the resolution, for the report
 * @param engine   database engine
 * @param host     host name; null for verbatim JDBC URLs
 * @param port     port; -1 for verbatim JDBC URLs
 * @param user     user name, may be empty
 * @param password password, may be empty
 * @param database database name; null for verbatim JDBC URLs
 * @param jdbcUrl  JDBC URL handed to the pool
 * @param params   query parameters carried by the URL-style variable
 */
public record BackendConfig(BackendKind kind, String origin, BackendEngine engine, String host, int port,
                            String user, String password, String database, String jdbcUrl,
                            Map<String, String> params) {

    public BackendConfig {
        params = params == null ? Map.of() : Map.copyOf(params);
        user = user == null ? "" : user;
        password = password == null ? "" : password;
    }

    public DbConfigSnapshot toSnapshot(BackendProperties.Pool pool) {
        return new DbConfigSnapshot(jdbcUrl, user.isEmpty() ? null : user, password, engine.getDriverClassName(),
                pool.getMaximumPoolSize(), pool.getMinimumIdle(), pool.getIdleTimeoutMs(),
                pool.getConnectionTimeoutMs(), pool.getMaxLifetimeMs());
    }

    /** Connection description without credentials. */
    public String describe() {
        return String.format("%s via %s (%s, user=%s)", kind, origin, InputValidator.sanitizeForLogging(jdbcUrl),
                user.isEmpty() ? "<none>" : user);
    }

    @Override
    public String toString() {
        return "BackendConfig[" + describe() + "]";
    }
}
