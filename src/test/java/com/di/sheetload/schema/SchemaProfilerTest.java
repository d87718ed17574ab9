package com.di.sheetload.schema;

import com.di.sheetload.exception.MalformedSourceException;
import com.di.sheetload.source.SourceSheet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static com.di.sheetload.SheetFixtures.row;
import static com.di.sheetload.SheetFixtures.sheet;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SchemaProfiler Tests")
class SchemaProfilerTest {

    private final SchemaProfiler profiler = new SchemaProfiler();
    private final NullTokens nullTokens = new NullTokens(List.of("Notreported", "N/A"));

    // ============================================================================
    // Duplicate header disambiguation
    // ============================================================================

    @Test
    @DisplayName("Should label repeated headers with .N suffixes")
    void testDisambiguate_Suffixes() {
        assertEquals(List.of("pH", "RH", "pH.1", "note", "pH.2", "note.1"),
                SchemaProfiler.disambiguate(List.of("pH", "RH", "pH", "note", "pH", "note"), 4));
    }

    @Test
    @DisplayName("Should keep blank headers positionally")
    void testDisambiguate_Blanks() {
        assertEquals(List.of("a", "", "b", ""),
                SchemaProfiler.disambiguate(Arrays.asList("a", "", " b ", null), 4));
    }

    @Test
    @DisplayName("Should fail when a generated label collides with a delivered header")
    void testDisambiguate_Collision() {
        MalformedSourceException ex = assertThrows(MalformedSourceException.class,
                () -> SchemaProfiler.disambiguate(List.of("pH", "pH", "pH.1"), 4));
        assertEquals(Optional.of("sheet row 4"), ex.getLocation());
        assertTrue(ex.getMessage().contains("pH.1"));
    }

    // ============================================================================
    // Profile
    // ============================================================================

    @Test
    @DisplayName("Should report column count, positions and null density")
    void testProfile() {
        SourceSheet sheet = sheet(List.of("Title", "pH", "", "pH"), List.of(
                row("A", "7", "x", "N/A"),
                row("B", "", "y", "8"),
                row("C", "Notreported", "", "9"),
                row("D", "6")));

        SourceProfile profile = profiler.profile(sheet, nullTokens);

        assertEquals(4, profile.getColumnCount());
        assertEquals(4, profile.getRowCount());
        assertEquals(List.of("Title", "pH", "", "pH.1"), profile.getHeaders());
        assertEquals(Optional.of(3), profile.positionOf("pH.1"));
        assertEquals(Optional.empty(), profile.positionOf(""));
        assertEquals(0.0, profile.getNullDensity().get(0));
        assertEquals(0.5, profile.getNullDensity().get(1));
        assertEquals(0.5, profile.getNullDensity().get(2));
        assertEquals(0.5, profile.getNullDensity().get(3));
    }

    @Test
    @DisplayName("Should not mutate the source sheet")
    void testProfile_ReadOnly() {
        SourceSheet sheet = sheet(List.of("a", "a"), List.of(row("1", "2")));
        profiler.profile(sheet, nullTokens);
        assertEquals(List.of("a", "a"), sheet.getRawHeader());
        assertEquals(List.of("1", "2"), sheet.getRows().get(0).cells());
    }

    @Test
    @DisplayName("Should report zero density for a sheet without data rows")
    void testProfile_NoRows() {
        SourceProfile profile = profiler.profile(sheet(List.of("a"), List.of()), nullTokens);
        assertEquals(0, profile.getRowCount());
        assertEquals(0.0, profile.getNullDensity().get(0));
    }
}
