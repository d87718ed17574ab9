package com.di.sheetload.service;

import com.di.sheetload.backend.AmbientConfigReader;
import com.di.sheetload.backend.BackendConfig;
import com.di.sheetload.backend.BackendDataSources;
import com.di.sheetload.backend.DbConfigSnapshot;
import com.di.sheetload.backend.EnvironmentResolver;
import com.di.sheetload.config.BackendProperties;
import com.di.sheetload.config.IngestionProperties;
import com.di.sheetload.exception.PartialLoadException;
import com.di.sheetload.filter.FilterOutcome;
import com.di.sheetload.filter.FilterPredicate;
import com.di.sheetload.filter.RowFilter;
import com.di.sheetload.load.BatchLoader;
import com.di.sheetload.load.LoadResult;
import com.di.sheetload.load.LoadSettings;
import com.di.sheetload.reconcile.ColumnMapping;
import com.di.sheetload.reconcile.ReconciledRow;
import com.di.sheetload.reconcile.RowAssembler;
import com.di.sheetload.reconcile.SchemaReconciler;
import com.di.sheetload.reconcile.ValueNormalizer;
import com.di.sheetload.report.FilterPreviewReport;
import com.di.sheetload.report.LoadReport;
import com.di.sheetload.report.ProfileReport;
import com.di.sheetload.report.ReconciliationReport;
import com.di.sheetload.report.RejectedRow;
import com.di.sheetload.report.RejectionStage;
import com.di.sheetload.schema.AnchorColumn;
import com.di.sheetload.schema.NullTokens;
import com.di.sheetload.schema.SchemaProfiler;
import com.di.sheetload.schema.SourceProfile;
import com.di.sheetload.schema.TargetSchema;
import com.di.sheetload.source.ReadOptions;
import com.di.sheetload.source.SourceReaderRegistry;
import com.di.sheetload.source.SourceSheet;
import com.di.sheetload.verify.LoadVerifier;
import com.di.sheetload.verify.VerificationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Composes the pipeline stages behind the four commands: {@code profile}, {@code reconcile},
 * {@code filter-preview} and {@code load}.
 *
 * <p>Every command is one synchronous run with its own run id in the MDC. The backend is resolved
 * once at the top of a load and handed down by parameter; nothing below this class reads ambient
 * configuration. Structural failures propagate as {@link com.di.sheetload.exception.IngestionException}
 * subclasses; row-level exclusions end up in the report.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    static final String RUN_ID = "runId";

    private final SourceReaderRegistry sourceReaders;
    private final SchemaProfiler profiler;
    private final SchemaReconciler reconciler;
    private final RowFilter rowFilter;
    private final AmbientConfigReader ambientConfigReader;
    private final EnvironmentResolver environmentResolver;
    private final BatchLoader loader;
    private final LoadVerifier verifier;
    private final TargetSchema targetSchema;
    private final IngestionProperties ingestProperties;
    private final BackendProperties backendProperties;

    // ------------------------------------------------------------------ //
    // Commands                                                            //
    // ------------------------------------------------------------------ //

    public ProfileReport profile(Path path) {
        return inRun("profile", path, runId -> {
            SourceSheet sheet = read(path);
            SourceProfile profile = profiler.profile(sheet, nullTokens());
            List<ProfileReport.ColumnProfile> columns = new ArrayList<>(profile.getColumnCount());
            for (int i = 0; i < profile.getColumnCount(); i++) {
                columns.add(new ProfileReport.ColumnProfile(i, profile.headerAt(i),
                        profile.getNullDensity().getOrDefault(i, 0.0)));
            }
            return ProfileReport.builder()
                    .sourceName(profile.getSourceName())
                    .sheetName(profile.getSheetName())
                    .headerRowNumber(sheet.getHeaderRowNumber())
                    .columnCount(profile.getColumnCount())
                    .rowCount(profile.getRowCount())
                    .columns(columns)
                    .build();
        });
    }

    public ReconciliationReport reconcile(Path path) {
        return inRun("reconcile", path, runId -> {
            Prepared prepared = prepare(path);
            ColumnMapping mapping = prepared.mapping();
            List<ReconciliationReport.FieldSource> fields = new ArrayList<>(targetSchema.size());
            for (int i = 0; i < targetSchema.size(); i++) {
                int source = mapping.sourceIndexOf(i);
                fields.add(new ReconciliationReport.FieldSource(i, targetSchema.field(i).name(), source,
                        source == ColumnMapping.ABSENT ? null : prepared.profile().headerAt(source)));
            }
            return ReconciliationReport.builder()
                    .sourceName(prepared.profile().getSourceName())
                    .sourceColumns(prepared.profile().getColumnCount())
                    .targetFields(targetSchema.size())
                    .matchedByName(mapping.getMatchedByName())
                    .matchedByPosition(mapping.getMatchedByPosition())
                    .positionalIdentity(mapping.isPositionalIdentity())
                    .anchorPositions(mapping.getAnchorPositions())
                    .absentFields(mapping.getAbsentFields())
                    .ignoredColumns(mapping.getIgnoredColumns())
                    .fields(fields)
                    .build();
        });
    }

    public FilterPreviewReport filterPreview(Path path) {
        return inRun("filter-preview", path, runId -> {
            Prepared prepared = prepare(path);
            RunTally tally = new RunTally();
            long assembled;
            try (Stream<ReconciledRow> rows = reconciledRows(prepared, tally)) {
                assembled = rows.count();
            }
            Map<String, Long> reasons = tally.rejected.stream()
                    .collect(Collectors.groupingBy(RejectedRow::reason, LinkedHashMap::new, Collectors.counting()));
            log.info("[FILTER] preview {}: read={} eligible={} filteredOut={} rejected={}",
                    prepared.profile().getSourceName(), tally.rowsRead, tally.rowsEligible,
                    tally.rowsFilteredOut, tally.rowsEligible - assembled);
            return FilterPreviewReport.builder()
                    .sourceName(prepared.profile().getSourceName())
                    .rowsRead(tally.rowsRead)
                    .rowsEligible(tally.rowsEligible)
                    .rowsFilteredOut(tally.rowsFilteredOut)
                    .rowsRejected(tally.rowsEligible - assembled)
                    .reasonCounts(reasons)
                    .rejectedRows(List.copyOf(tally.rejected))
                    .build();
        });
    }

    /**
     * Runs the whole pipeline and writes the eligible rows.
     *
     * @throws PartialLoadException with the partial {@link LoadReport} attached when a batch fails
     */
    public LoadReport load(Path path) {
        return inRun("load", path, runId -> {
            Instant startedAt = Instant.now();
            BackendConfig backend = environmentResolver.resolve(
                    ambientConfigReader.snapshot(backendProperties), backendProperties);
            Prepared prepared = prepare(path);
            LoadSettings settings = new LoadSettings(ingestProperties.getTable(), ingestProperties.getBatchSize(),
                    ingestProperties.getWriteMode(), ingestProperties.getRunIdColumn(), runId);
            DbConfigSnapshot snapshot = backend.toSnapshot(backendProperties.getPool());

            RunTally tally = new RunTally();
            try (Stream<ReconciledRow> rows = reconciledRows(prepared, tally)) {
                Iterator<ReconciledRow> iterator = rows.iterator();
                LoadResult result;
                try {
                    result = loader.load(backend, snapshot, targetSchema, iterator, settings);
                } catch (PartialLoadException e) {
                    LoadResult partial = e.getPartialResult();
                    if (partial != null) {
                        e.withReport(report(runId, prepared, backend, settings, tally, partial,
                                verify(snapshot, partial, runId), startedAt));
                    }
                    throw e;
                }
                LoadReport report = report(runId, prepared, backend, settings, tally, result,
                        verify(snapshot, result, runId), startedAt);
                log.info("[LOAD] Run complete: read={} filteredOut={} rejected={} loaded={} verified={}",
                        report.getRowsRead(), report.getRowsFilteredOut(), report.getRowsRejected(),
                        report.getRowsLoaded(), report.getVerifiedCount());
                return report;
            }
        });
    }

    // ------------------------------------------------------------------ //
    // Pipeline stages                                                     //
    // ------------------------------------------------------------------ //

    private Prepared prepare(Path path) {
        List<AnchorColumn> anchors = ingestProperties.toAnchorColumns();
        List<FilterPredicate> chain = ingestProperties.toPredicateChain();
        rowFilter.validateChain(chain, anchors.stream().map(AnchorColumn::name).toList());

        SourceSheet sheet = read(path);
        SourceProfile profile = profiler.profile(sheet, nullTokens());
        ColumnMapping mapping = reconciler.reconcile(profile, targetSchema, anchors, sheet.getHeaderRowNumber());
        return new Prepared(sheet, profile, mapping, chain);
    }

    private SourceSheet read(Path path) {
        return sourceReaders.read(path, new ReadOptions(ingestProperties.getHeaderRow(), ingestProperties.getSheetName()));
    }

    /** Lazy filter-then-assemble stream; exclusions are recorded in {@code tally} as rows are pulled. */
    private Stream<ReconciledRow> reconciledRows(Prepared prepared, RunTally tally) {
        NullTokens nullTokens = nullTokens();
        RowAssembler assembler = new RowAssembler(targetSchema, prepared.mapping(),
                new ValueNormalizer(nullTokens, ingestProperties.getMaxTextLength()));
        return rowFilter.apply(prepared.sheet().getRows().stream(), prepared.mapping(), prepared.chain(), nullTokens)
                .filter(tally::admit)
                .map(outcome -> assembler.assemble(outcome.row()))
                .filter(tally::keep)
                .map(RowAssembler.Assembled::row);
    }

    private VerificationResult verify(DbConfigSnapshot snapshot, LoadResult result, String runId) {
        return verifier.verify(BackendDataSources.INSTANCE.getOrInit(snapshot), result, runId,
                ingestProperties.getSampleColumns(), ingestProperties.getSampleSize());
    }

    private LoadReport report(String runId, Prepared prepared, BackendConfig backend, LoadSettings settings,
                              RunTally tally, LoadResult result, VerificationResult verification, Instant startedAt) {
        List<String> warnings = new ArrayList<>(result.getWarnings());
        warnings.addAll(verification.getWarnings());
        long coercionRejected = tally.rejected.stream().filter(r -> r.stage() == RejectionStage.COERCION).count();
        return LoadReport.builder()
                .runId(runId)
                .sourceName(prepared.profile().getSourceName())
                .table(settings.table())
                .backendKind(backend.kind())
                .backendOrigin(backend.origin())
                .rowsRead(tally.rowsRead)
                .rowsFilteredOut(tally.rowsFilteredOut)
                .rowsRejected(coercionRejected)
                .rowsLoaded(result.getRowsLoaded())
                .batchesCommitted(result.getBatchesCommitted())
                .batchSize(settings.batchSize())
                .rowsDeleted(result.getRowsDeleted())
                .verificationMethod(verification.getMethod())
                .verifiedCount(verification.getVerifiedRows())
                .rejectedRows(List.copyOf(tally.rejected))
                .warnings(List.copyOf(warnings))
                .samples(verification.getSamples())
                .startedAt(startedAt)
                .completedAt(Instant.now())
                .build();
    }

    private NullTokens nullTokens() {
        return new NullTokens(ingestProperties.getNullTokens());
    }

    private <T> T inRun(String command, Path path, RunBody<T> body) {
        String runId = "run-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put(RUN_ID, runId);
        try {
            log.info("{} {} | schema={} fields | table={}", command, path, targetSchema.size(), ingestProperties.getTable());
            return body.run(runId);
        } finally {
            MDC.remove(RUN_ID);
        }
    }

    @FunctionalInterface
    private interface RunBody<T> {
        T run(String runId);
    }

    private record Prepared(SourceSheet sheet, SourceProfile profile, ColumnMapping mapping,
                            List<FilterPredicate> chain) {
    }

    /**
     * Counts rows as the lazy stream is pulled. Rows the loader never pulls (after a failed batch)
     * are not counted.
     */
    private static final class RunTally {
        long rowsRead;
        long rowsEligible;
        long rowsFilteredOut;
        final List<RejectedRow> rejected = new ArrayList<>();

        boolean admit(FilterOutcome outcome) {
            rowsRead++;
            if (outcome.eligible()) {
                rowsEligible++;
                return true;
            }
            rowsFilteredOut++;
            rejected.add(new RejectedRow(outcome.rowNumber(), outcome.reason(), RejectionStage.FILTER));
            return false;
        }

        boolean keep(RowAssembler.Assembled assembled) {
            if (assembled.isRejected()) {
                rejected.add(assembled.rejection());
                return false;
            }
            return true;
        }
    }
}
