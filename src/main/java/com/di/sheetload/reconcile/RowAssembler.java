package com.di.sheetload.reconcile;

import com.di.sheetload.report.RejectedRow;
import com.di.sheetload.report.RejectionStage;
import com.di.sheetload.schema.FieldSpec;
import com.di.sheetload.schema.TargetSchema;
import com.di.sheetload.source.SourceRow;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Selects, in target order, the source cells a {@link ColumnMapping} points at and coerces them.
 * Source columns outside the mapping are dropped. A cell that cannot be coerced rejects the whole
 * row; nothing is raised.
 */
@Slf4j
public class RowAssembler {

    private final TargetSchema schema;
    private final ColumnMapping mapping;
    private final ValueNormalizer normalizer;

    public RowAssembler(TargetSchema schema, ColumnMapping mapping, ValueNormalizer normalizer) {
        this.schema = schema;
        this.mapping = mapping;
        this.normalizer = normalizer;
    }

    public Assembled assemble(SourceRow row) {
        List<Object> values = new ArrayList<>(schema.size());
        for (int i = 0; i < schema.size(); i++) {
            FieldSpec field = schema.field(i);
            int source = mapping.sourceIndexOf(i);
            String raw = source == ColumnMapping.ABSENT ? null : row.cell(source);
            try {
                values.add(normalizer.normalize(raw, field));
            } catch (NumberFormatException e) {
                log.debug("[LOAD] row {} rejected: field '{}' value '{}' is not {}",
                        row.rowNumber(), field.name(), raw, field.type());
                return Assembled.rejected(new RejectedRow(row.rowNumber(),
                        "coercion-failed:" + field.name(), RejectionStage.COERCION));
            }
        }
        return Assembled.of(new ReconciledRow(row.rowNumber(), values));
    }

    /**
     * Either a reconciled row or the reason the source row was rejected.
     */
    public record Assembled(ReconciledRow row, RejectedRow rejection) {

        static Assembled of(ReconciledRow row) {
            return new Assembled(row, null);
        }

        static Assembled rejected(RejectedRow rejection) {
            return new Assembled(null, rejection);
        }

        public boolean isRejected() {
            return rejection != null;
        }
    }
}
