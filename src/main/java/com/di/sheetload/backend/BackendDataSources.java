package com.di.sheetload.backend;

import com.di.sheetload.util.InputValidator;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe HikariCP pool cache. Each backend (JDBC URL + user) gets its own pool, created on
 * first use and kept for later runs against the same backend.
 */
@Slf4j
public enum BackendDataSources {

    INSTANCE;

    private final ConcurrentMap<String, HikariDataSource> dataSourceCache = new ConcurrentHashMap<>();

    /** Stable, positive pool ids for log correlation. */
    private static final AtomicInteger poolIdCounter = new AtomicInteger(0);

    /**
     * Gets or creates the pool for the given configuration. Pool creation does not connect; the
     * first {@code getConnection()} does.
     *
     * @param snapshot Database configuration snapshot
     * @return DataSource for the specified database configuration
     */
    public DataSource getOrInit(DbConfigSnapshot snapshot) {
        return dataSourceCache.computeIfAbsent(snapshot.connectionKey(), key -> {
            HikariConfig hikariConfig = new HikariConfig();
            hikariConfig.setJdbcUrl(snapshot.jdbcUrl());
            hikariConfig.setUsername(snapshot.username());
            hikariConfig.setPassword(snapshot.password());
            if (snapshot.driverClassName() != null && !snapshot.driverClassName().isBlank()) {
                hikariConfig.setDriverClassName(snapshot.driverClassName());
            }
            hikariConfig.setMaximumPoolSize(snapshot.maximumPoolSize());
            hikariConfig.setMinimumIdle(snapshot.minimumIdle());
            hikariConfig.setIdleTimeout(snapshot.idleTimeoutMs());
            hikariConfig.setConnectionTimeout(snapshot.connectionTimeoutMs());
            hikariConfig.setMaxLifetime(snapshot.maxLifetimeMs());
            // do not fail at construction; an unreachable backend surfaces on the first getConnection()
            hikariConfig.setInitializationFailTimeout(-1);

            if (snapshot.jdbcUrl().contains("postgresql")) {
                hikariConfig.addDataSourceProperty("tcpKeepAlive", "true");
            }
            hikariConfig.setPoolName("SheetLoadPool-" + poolIdCounter.incrementAndGet() + "-" + shortPoolKey(snapshot));

            HikariDataSource dataSource = new HikariDataSource(hikariConfig);
            log.info("[POOL] Created {} | url={} | user={} | maxPoolSize={} | minIdle={}",
                    hikariConfig.getPoolName(), InputValidator.sanitizeForLogging(snapshot.jdbcUrl()),
                    snapshot.username(), snapshot.maximumPoolSize(), snapshot.minimumIdle());
            return dataSource;
        });
    }

    /**
     * Short, readable pool key (host, database, user) for monitoring; never contains the password.
     */
    static String shortPoolKey(DbConfigSnapshot snapshot) {
        String url = InputValidator.sanitizeForLogging(snapshot.jdbcUrl());
        String user = snapshot.username() != null ? snapshot.username() : "anonymous";
        String part = url;
        int slashSlash = url.indexOf("//");
        if (slashSlash >= 0) {
            part = url.substring(slashSlash + 2);
            int at = part.lastIndexOf('@');
            if (at >= 0) {
                part = part.substring(at + 1);
            }
        } else if (url.startsWith("jdbc:")) {
            part = url.substring(5);
        }
        int slashDb = part.indexOf('/');
        String hostPort = slashDb >= 0 ? part.substring(0, slashDb) : part;
        String db = slashDb >= 0 && slashDb < part.length() - 1 ? part.substring(slashDb + 1).split("[?;]")[0] : "";
        String host = hostPort.split("[:;]")[0];
        String safe = (host + "_" + db + "_" + user).replaceAll("[^a-zA-Z0-9_]", "_").replaceAll("_+", "_");
        return safe.isEmpty() ? "pool" : safe;
    }

    /** Logs active/idle/waiting counts of the pool behind the given snapshot, if it exists. */
    public void logPoolStats(DbConfigSnapshot snapshot, String phase) {
        HikariDataSource dataSource = dataSourceCache.get(snapshot.connectionKey());
        if (dataSource == null) {
            return;
        }
        HikariPoolMXBean pool = dataSource.getHikariPoolMXBean();
        if (pool != null) {
            log.debug("[POOL] {} | {} | active={} | idle={} | total={} | waiting={}", dataSource.getPoolName(), phase,
                    pool.getActiveConnections(), pool.getIdleConnections(), pool.getTotalConnections(),
                    pool.getThreadsAwaitingConnection());
        }
    }

    /**
     * Closes and removes the pool for the given configuration.
     *
     * @param snapshot Database configuration snapshot
     */
    public void closeDataSource(DbConfigSnapshot snapshot) {
        HikariDataSource dataSource = dataSourceCache.remove(snapshot.connectionKey());
        if (dataSource != null) {
            dataSource.close();
            log.info("[POOL] Closed {}", dataSource.getPoolName());
        }
    }

    /**
     * Closes all pools and clears the cache. Called on application shutdown.
     */
    public void closeAll() {
        log.info("[POOL] Closing all pools (count: {})", dataSourceCache.size());
        dataSourceCache.forEach((key, dataSource) -> {
            try {
                dataSource.close();
            } catch (RuntimeException e) {
                log.warn("[POOL] Error closing pool {}", dataSource.getPoolName(), e);
            }
        });
        dataSourceCache.clear();
    }
}
