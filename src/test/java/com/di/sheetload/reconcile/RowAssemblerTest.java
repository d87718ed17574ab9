package com.di.sheetload.reconcile;

import com.di.sheetload.SheetFixtures;
import com.di.sheetload.report.RejectionStage;
import com.di.sheetload.schema.FieldSpec;
import com.di.sheetload.schema.NullTokens;
import com.di.sheetload.schema.SemanticType;
import com.di.sheetload.schema.TargetSchema;
import com.di.sheetload.source.SourceRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RowAssembler Tests")
class RowAssemblerTest {

    private static final ValueNormalizer NORMALIZER = new ValueNormalizer(new NullTokens(List.of("Notreported")), 255);

    private static ColumnMapping mapping(Integer... sources) {
        return ColumnMapping.builder()
                .sourceIndexByTarget(Arrays.asList(sources))
                .anchorPositions(Map.of())
                .ignoredColumns(Map.of())
                .absentFields(List.of())
                .build();
    }

    @Test
    @DisplayName("Should emit exactly one value per target field and drop extra source columns")
    void testAlignment() {
        TargetSchema schema = new TargetSchema(List.of(FieldSpec.text("Title"),
                new FieldSpec("Year", null, SemanticType.INTEGER, false),
                new FieldSpec("note", null, SemanticType.TEXT, true)));
        RowAssembler assembler = new RowAssembler(schema, mapping(0, 1, ColumnMapping.ABSENT), NORMALIZER);

        RowAssembler.Assembled result = assembler.assemble(
                new SourceRow(5, List.of("Paper", "2019", "extra", "SMD")));

        assertFalse(result.isRejected());
        assertEquals(5, result.row().rowNumber());
        assertEquals(Arrays.asList("Paper", 2019L, null), result.row().values());
    }

    @Test
    @DisplayName("Should read null for short rows and null tokens")
    void testShortRow() {
        TargetSchema schema = SheetFixtures.schema(3);
        RowAssembler assembler = new RowAssembler(schema, mapping(0, 1, 2), NORMALIZER);

        RowAssembler.Assembled result = assembler.assemble(new SourceRow(9, List.of("a", "Notreported")));

        assertEquals(Arrays.asList("a", null, null), result.row().values());
    }

    @Test
    @DisplayName("Should reject the row when a cell cannot be coerced")
    void testCoercionRejection() {
        TargetSchema schema = new TargetSchema(List.of(FieldSpec.text("Title"),
                new FieldSpec("Year", null, SemanticType.INTEGER, false)));
        RowAssembler assembler = new RowAssembler(schema, mapping(0, 1), NORMALIZER);

        RowAssembler.Assembled result = assembler.assemble(new SourceRow(12, List.of("Paper", "in press")));

        assertTrue(result.isRejected());
        assertNull(result.row());
        assertEquals(12, result.rejection().rowNumber());
        assertEquals("coercion-failed:Year", result.rejection().reason());
        assertEquals(RejectionStage.COERCION, result.rejection().stage());
    }
}
