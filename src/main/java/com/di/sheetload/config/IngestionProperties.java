package com.di.sheetload.config;

import com.di.sheetload.filter.FilterPredicate;
import com.di.sheetload.filter.PredicateOperator;
import com.di.sheetload.schema.AnchorColumn;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Binding for everything that shapes an ingestion run except the backend.
 *
 * <pre>
 * sheetload:
 *   ingest:
 *     header-row: 3
 *     table: research_data
 *     batch-size: 500
 *     write-mode: APPEND
 *     anchors:
 *       - name: business-unit
 *         aliases: [business-unit-code, BU]
 *     filters:
 *       - anchor: business-unit
 *         operator: equals
 *         operands: [SMD]
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "sheetload.ingest")
public class IngestionProperties {

    // ------------------------------------------------------------------ //
    // Source layout                                                       //
    // ------------------------------------------------------------------ //

    /** 0-based row holding the header; the measurement workbook has three banner rows above it. */
    @Min(0)
    private int headerRow = 3;

    /** Sheet to read; first sheet when blank. */
    private String sheetName = "";

    /** Cell values treated as null, besides blank cells. */
    private List<String> nullTokens = new ArrayList<>(List.of("Notreported", "N/A", "NULL", "None", "nan"));

    @Min(1)
    private int maxTextLength = 2000;

    // ------------------------------------------------------------------ //
    // Target                                                              //
    // ------------------------------------------------------------------ //

    /** YAML resource holding the ordered target field list. */
    @NotBlank
    private String targetSchemaFile = "classpath:target_schema.yml";

    /** Field count the destination contract requires; 0 disables the check. */
    @Min(0)
    private int expectedFieldCount = 132;

    @NotBlank
    private String table = "research_data";

    /** Rows per transaction. */
    @Min(1)
    @Max(10_000)
    private int batchSize = 500;

    private WriteMode writeMode = WriteMode.APPEND;

    /** Optional column receiving the run id on every inserted row; used to verify exactly this run. */
    private String runIdColumn = "";

    // ------------------------------------------------------------------ //
    // Verification                                                        //
    // ------------------------------------------------------------------ //

    @Min(0)
    private int sampleSize = 3;

    private List<String> sampleColumns = new ArrayList<>(List.of("Title", "Author", "Year", "Fiber_type"));

    // ------------------------------------------------------------------ //
    // Anchors and filters                                                 //
    // ------------------------------------------------------------------ //

    @Valid
    private List<Anchor> anchors = new ArrayList<>();

    @Valid
    private List<Filter> filters = new ArrayList<>();

    public List<AnchorColumn> toAnchorColumns() {
        return anchors.stream()
                .map(a -> new AnchorColumn(a.getName(), a.getAliases(), a.isRequired()))
                .toList();
    }

    public List<FilterPredicate> toPredicateChain() {
        return filters.stream()
                .map(f -> new FilterPredicate(f.getAnchor(), PredicateOperator.fromLabel(f.getOperator()), f.getOperands()))
                .toList();
    }

    public boolean hasRunIdColumn() {
        return runIdColumn != null && !runIdColumn.isBlank();
    }

    @Data
    public static class Anchor {
        @NotBlank
        private String name;
        private List<String> aliases = new ArrayList<>();
        private boolean required = true;
    }

    @Data
    public static class Filter {
        @NotBlank
        private String anchor;
        /** equals | not-null | in-set */
        @NotBlank
        private String operator;
        private List<String> operands = new ArrayList<>();
    }
}
