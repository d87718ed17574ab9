package com.di.sheetload.config;

import com.di.sheetload.schema.FieldSpec;
import com.di.sheetload.schema.SemanticType;
import com.di.sheetload.schema.TargetSchema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TargetSchemaConfig Tests")
class TargetSchemaConfigTest {

    private final TargetSchemaConfig config = new TargetSchemaConfig();

    // ============================================================================
    // Bundled schema
    // ============================================================================

    @Test
    @DisplayName("Should load the bundled 132-field schema in storage order")
    void testBundledSchema() {
        TargetSchema schema = config.targetSchema(new DefaultResourceLoader(), new IngestionProperties());

        assertEquals(132, schema.size());
        assertEquals("feature_name", schema.field(0).name());
        assertEquals(new FieldSpec("Year", "Year", SemanticType.INTEGER, false), schema.field(5));
        assertEquals("No.", schema.field(6).header());
        assertEquals(Optional.of(6), schema.indexOfHeader("No."));
        assertEquals(Optional.of(7), schema.indexOfHeader("no."));
        assertEquals(132, schema.requiredFieldCount());
        assertTrue(schema.getFields().stream()
                .anyMatch(f -> f.name().equals("retention1") && f.type() == SemanticType.PERCENT));
    }

    @Test
    @DisplayName("Should fail when the field count differs from the contract")
    void testFieldCountMismatch() {
        IngestionProperties properties = new IngestionProperties();
        properties.setExpectedFieldCount(131);
        assertThrows(IllegalStateException.class,
                () -> config.targetSchema(new DefaultResourceLoader(), properties));
    }

    @Test
    @DisplayName("Should fail when the schema resource is missing")
    void testMissingResource() {
        IngestionProperties properties = new IngestionProperties();
        properties.setTargetSchemaFile("classpath:missing_schema.yml");
        assertThrows(IllegalStateException.class,
                () -> config.targetSchema(new DefaultResourceLoader(), properties));
    }

    // ============================================================================
    // Parsing
    // ============================================================================

    @Test
    @DisplayName("Should default header to name and type to text")
    void testParseDefaults() throws IOException {
        String yaml = "fields:\n"
                + "  - name: Title\n"
                + "  - name: diameter\n"
                + "    header: Diameter (um)\n"
                + "    type: DECIMAL\n"
                + "    nullable: true\n"
                + "    comment: ignored\n";

        TargetSchema schema = TargetSchemaConfig.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

        assertEquals(FieldSpec.text("Title"), schema.field(0));
        assertEquals(new FieldSpec("diameter", "Diameter (um)", SemanticType.DECIMAL, true), schema.field(1));
        assertEquals(1, schema.requiredFieldCount());
    }

    @Test
    @DisplayName("Should reject a document without fields")
    void testParseEmpty() {
        assertThrows(IllegalStateException.class,
                () -> TargetSchemaConfig.parse(new ByteArrayInputStream("fields:\n".getBytes(StandardCharsets.UTF_8))));
    }
}
