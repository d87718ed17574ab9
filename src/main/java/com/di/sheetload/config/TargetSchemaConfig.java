package com.di.sheetload.config;

import com.di.sheetload.schema.FieldSpec;
import com.di.sheetload.schema.TargetSchema;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the process-wide {@link TargetSchema} once at start-up from the YAML resource named by
 * {@code sheetload.ingest.target-schema-file}.
 *
 * <pre>
 * fields:
 *   - name: Journal_or_Conference_name
 *     header: Journal or Conference name
 *     type: TEXT
 *     nullable: false
 * </pre>
 */
@Slf4j
@Configuration
public class TargetSchemaConfig {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Bean
    public TargetSchema targetSchema(ResourceLoader resourceLoader, IngestionProperties properties) {
        String location = properties.getTargetSchemaFile().trim();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Target schema file not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            TargetSchema schema = parse(in).requireFieldCount(properties.getExpectedFieldCount());
            log.info("Loaded target schema from {}: {} field(s), {} required",
                    location, schema.size(), schema.requiredFieldCount());
            return schema;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read target schema file " + location, e);
        }
    }

    public static TargetSchema parse(InputStream in) throws IOException {
        Document document = YAML_MAPPER.readValue(in, Document.class);
        if (document == null || document.getFields() == null) {
            throw new IllegalStateException("Target schema document has no 'fields' list");
        }
        return new TargetSchema(document.getFields());
    }

    @Data
    static class Document {
        private List<FieldSpec> fields = new ArrayList<>();
    }
}
