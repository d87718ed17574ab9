package com.di.sheetload.backend;

import com.di.sheetload.config.BackendProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Takes the per-run snapshot of the ambient configuration the {@link EnvironmentResolver} works on.
 * The Spring {@link Environment} merges OS environment variables, system properties and
 * application.yml, so any of them can supply a connection variable.
 */
@Component
@RequiredArgsConstructor
public class AmbientConfigReader {

    private final Environment environment;

    public Map<String, String> snapshot(BackendProperties properties) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String name : properties.variableNames()) {
            String value = environment.getProperty(name);
            if (value != null) {
                values.put(name, value);
            }
        }
        return Collections.unmodifiableMap(values);
    }
}
