package com.di.sheetload.backend;

import com.di.sheetload.config.BackendProperties;
import com.di.sheetload.exception.BackendUnresolvedException;
import com.di.sheetload.util.InputValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Chooses the backend from an immutable snapshot of the ambient configuration, in strict priority:
 * <ol>
 *   <li>the first URL-style variable that is set, parsed fully and used exclusively;</li>
 *   <li>discrete host/port/user/password/database variables, activated by the host variable,
 *       with the documented defaults filling the gaps;</li>
 *   <li>the local default.</li>
 * </ol>
 * A pure function of its arguments: it reads nothing ambient itself and mutates nothing.
 */
@Slf4j
@Component
public class EnvironmentResolver {

    public BackendConfig resolve(Map<String, String> ambient, BackendProperties properties) {
        for (String variable : properties.getUrlVariables()) {
            String value = ambient.get(variable);
            if (hasText(value)) {
                BackendConfig config = fromUrl(variable, value.trim(), properties);
                log.info("[BACKEND] Resolved {}", config.describe());
                return config;
            }
        }

        String host = ambient.get(properties.getHostVariable());
        String port = ambient.get(properties.getPortVariable());
        String user = ambient.get(properties.getUserVariable());
        String password = ambient.get(properties.getPasswordVariable());
        String database = ambient.get(properties.getDatabaseVariable());

        if (hasText(host)) {
            BackendConfig config = fromDiscrete(host.trim(), port, user, password, database, properties);
            log.info("[BACKEND] Resolved {}", config.describe());
            return config;
        }
        if (hasText(port) || hasText(user) || hasText(password) || hasText(database)) {
            throw new BackendUnresolvedException(String.format(
                    "Discrete connection variables are set but %s is not; set %s or unset %s/%s/%s/%s",
                    properties.getHostVariable(), properties.getHostVariable(), properties.getPortVariable(),
                    properties.getUserVariable(), properties.getPasswordVariable(), properties.getDatabaseVariable()));
        }

        BackendProperties.Endpoint local = properties.getLocalDefault();
        BackendEngine engine = engineFor(properties.getDefaultScheme());
        BackendConfig config = new BackendConfig(BackendKind.LOCAL_DEFAULT, "local-default", engine,
                local.getHost(), local.getPort(), local.getUser(), local.getPassword(), local.getDatabase(),
                engine.jdbcUrl(local.getHost(), local.getPort(), local.getDatabase(), Map.of()), Map.of());
        log.info("[BACKEND] No connection configuration found; using {}", config.describe());
        return config;
    }

    private BackendConfig fromUrl(String variable, String value, BackendProperties properties) {
        if (value.regionMatches(true, 0, "jdbc:", 0, 5)) {
            try {
                return new BackendConfig(BackendKind.MANAGED_CLOUD, variable, BackendEngine.GENERIC, null, -1,
                        null, null, null, InputValidator.validateJdbcUrl(value), Map.of());
            } catch (IllegalArgumentException e) {
                throw new BackendUnresolvedException(variable + " is not a usable JDBC URL: " + e.getMessage(), e);
            }
        }

        ConnectionUrlParser.ParsedUrl parsed;
        BackendEngine engine;
        try {
            parsed = ConnectionUrlParser.parse(value);
            engine = BackendEngine.fromScheme(parsed.scheme());
        } catch (IllegalArgumentException e) {
            throw new BackendUnresolvedException(String.format("%s cannot be parsed (%s): %s",
                    variable, InputValidator.sanitizeForLogging(value), e.getMessage()), e);
        }
        if (parsed.database() == null) {
            throw new BackendUnresolvedException(variable + " names no database: "
                    + InputValidator.sanitizeForLogging(value));
        }
        if (hasText(parsed.password()) && !hasText(parsed.user())) {
            throw new BackendUnresolvedException(variable + " carries a password without a user");
        }
        int port = parsed.port() > 0 ? parsed.port() : engine.getDefaultPort();
        return new BackendConfig(BackendKind.MANAGED_CLOUD, variable, engine, parsed.host(), port,
                parsed.user(), parsed.password(), parsed.database(),
                engine.jdbcUrl(parsed.host(), port, parsed.database(), parsed.params()), parsed.params());
    }

    private BackendConfig fromDiscrete(String host, String portText, String user, String password, String database,
                                       BackendProperties properties) {
        if (hasText(password) && !hasText(user)) {
            throw new BackendUnresolvedException(String.format("%s is set without %s",
                    properties.getPasswordVariable(), properties.getUserVariable()));
        }
        BackendProperties.Endpoint defaults = properties.getDiscreteDefaults();
        int port = defaults.getPort();
        if (hasText(portText)) {
            try {
                port = Integer.parseInt(portText.trim());
            } catch (NumberFormatException e) {
                throw new BackendUnresolvedException(String.format("%s is not a number: '%s'",
                        properties.getPortVariable(), portText), e);
            }
            if (port < 1 || port > 65535) {
                throw new BackendUnresolvedException(properties.getPortVariable() + " out of range: " + port);
            }
        }
        String effectiveUser = hasText(user) ? user.trim() : defaults.getUser();
        String effectivePassword = hasText(password) ? password : defaults.getPassword();
        String effectiveDatabase = hasText(database) ? database.trim() : defaults.getDatabase();
        BackendEngine engine = engineFor(properties.getDefaultScheme());
        return new BackendConfig(BackendKind.EXPLICIT_ENV, properties.getHostVariable(), engine, host, port,
                effectiveUser, effectivePassword, effectiveDatabase,
                engine.jdbcUrl(host, port, effectiveDatabase, Map.of()), Map.of());
    }

    private static BackendEngine engineFor(String scheme) {
        try {
            return BackendEngine.fromScheme(scheme);
        } catch (IllegalArgumentException e) {
            throw new BackendUnresolvedException("Default scheme is not supported: " + e.getMessage(), e);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
