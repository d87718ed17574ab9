package com.di.sheetload.backend;

import com.di.sheetload.util.InputValidator;

/**
 * Everything needed to build a connection pool for one backend. Pools are shared per
 * {@link #connectionKey()}.
 */
public record DbConfigSnapshot(String jdbcUrl, String username, String password, String driverClassName,
                               int maximumPoolSize, int minimumIdle, long idleTimeoutMs, long connectionTimeoutMs,
                               long maxLifetimeMs) {

    public DbConfigSnapshot {
        jdbcUrl = InputValidator.validateJdbcUrl(jdbcUrl);
        InputValidator.validatePoolSize(maximumPoolSize);
        minimumIdle = Math.max(0, Math.min(minimumIdle, maximumPoolSize));
    }

    /** Pool identity: URL and user. The password is deliberately not part of it. */
    public String connectionKey() {
        return jdbcUrl + "|" + username;
    }

    @Override
    public String toString() {
        return "DbConfigSnapshot[jdbcUrl=" + InputValidator.sanitizeForLogging(jdbcUrl)
                + ", username=" + username
                + ", password=" + (password == null || password.isEmpty() ? "<none>" : "***")
                + ", driverClassName=" + driverClassName
                + ", maximumPoolSize=" + maximumPoolSize
                + ", minimumIdle=" + minimumIdle + "]";
    }
}
