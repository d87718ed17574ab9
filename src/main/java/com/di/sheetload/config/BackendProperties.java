package com.di.sheetload.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Names of the ambient variables the backend is resolved from, the documented defaults, and the
 * connection pool settings. The variable values themselves are read per run, not bound here.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "sheetload.backend")
public class BackendProperties {

    /** URL-style variables, highest priority first. The first one set wins. */
    private List<String> urlVariables = new ArrayList<>(List.of("DATABASE_URL", "MYSQL_URL"));

    private String hostVariable = "DB_HOST";
    private String portVariable = "DB_PORT";
    private String userVariable = "DB_USER";
    private String passwordVariable = "DB_PASSWORD";
    private String databaseVariable = "DB_NAME";

    /** Scheme assumed for discrete variables and the local default. */
    private String defaultScheme = "mysql";

    /** Fills the gaps when only some discrete variables are set. */
    @Valid
    private Endpoint discreteDefaults = new Endpoint(null, 3306, "root", "", "railway");

    /** Used when no connection configuration is present at all. */
    @Valid
    private Endpoint localDefault = new Endpoint("localhost", 3306, "root", "", "haigui_database");

    @Valid
    private Pool pool = new Pool();

    /** Every variable name the resolver may read. */
    public List<String> variableNames() {
        List<String> names = new ArrayList<>(urlVariables);
        names.addAll(List.of(hostVariable, portVariable, userVariable, passwordVariable, databaseVariable));
        return names;
    }

    @Data
    public static class Endpoint {
        private String host;
        @Min(1)
        @Max(65535)
        private int port;
        private String user;
        private String password;
        private String database;

        public Endpoint() {
        }

        public Endpoint(String host, int port, String user, String password, String database) {
            this.host = host;
            this.port = port;
            this.user = user;
            this.password = password;
            this.database = database;
        }
    }

    @Data
    public static class Pool {
        @Min(1)
        @Max(100)
        private int maximumPoolSize = 4;
        @Min(0)
        private int minimumIdle = 0;
        private long connectionTimeoutMs = 10_000L;
        private long idleTimeoutMs = 60_000L;
        private long maxLifetimeMs = 1_800_000L;
    }
}
