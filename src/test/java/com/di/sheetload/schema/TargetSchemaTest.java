package com.di.sheetload.schema;

import com.di.sheetload.SheetFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TargetSchema Tests")
class TargetSchemaTest {

    // ============================================================================
    // Construction
    // ============================================================================

    @Test
    @DisplayName("Should keep field order and default header and type")
    void testFieldOrderAndDefaults() {
        TargetSchema schema = new TargetSchema(List.of(
                new FieldSpec("Title", null, null, false),
                new FieldSpec("No_field", "No.", SemanticType.TEXT, true)));

        assertEquals(List.of("Title", "No_field"), schema.fieldNames());
        assertEquals("Title", schema.field(0).header());
        assertEquals(SemanticType.TEXT, schema.field(0).type());
        assertEquals(1, schema.requiredFieldCount());
    }

    @Test
    @DisplayName("Should reject empty schemas, duplicate names and invalid column names")
    void testInvalidSchemas() {
        assertThrows(IllegalArgumentException.class, () -> new TargetSchema(List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new TargetSchema(List.of(FieldSpec.text("Title"), FieldSpec.text("title"))));
        assertThrows(IllegalArgumentException.class,
                () -> new TargetSchema(List.of(FieldSpec.text("No."))));
        assertThrows(IllegalArgumentException.class, () -> new TargetSchema(List.of(
                new FieldSpec("pH_1", "pH", SemanticType.TEXT, false),
                new FieldSpec("pH_2", "pH", SemanticType.TEXT, false))));
    }

    @Test
    @DisplayName("Should enforce the destination field count")
    void testRequireFieldCount() {
        TargetSchema schema = SheetFixtures.schema(131);
        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> schema.requireFieldCount(132));
        assertTrue(ex.getMessage().contains("131"));
        assertSame(schema, schema.requireFieldCount(131));
        assertSame(schema, schema.requireFieldCount(0));
    }

    // ============================================================================
    // Header lookup
    // ============================================================================

    @Test
    @DisplayName("Should look headers up exactly, then case-insensitively when unambiguous")
    void testIndexOfHeader() {
        TargetSchema schema = new TargetSchema(List.of(
                FieldSpec.text("Title"),
                new FieldSpec("OTHER_main", "OTHER", SemanticType.TEXT, false),
                new FieldSpec("other_lower", "other", SemanticType.TEXT, false)));

        assertEquals(Optional.of(0), schema.indexOfHeader("Title"));
        assertEquals(Optional.of(0), schema.indexOfHeader(" TITLE "));
        assertEquals(Optional.of(1), schema.indexOfHeader("OTHER"));
        assertEquals(Optional.of(2), schema.indexOfHeader("other"));
        assertEquals(Optional.empty(), schema.indexOfHeader("Other"));
        assertEquals(Optional.empty(), schema.indexOfHeader(""));
        assertEquals(Optional.empty(), schema.indexOfHeader(null));
    }
}
