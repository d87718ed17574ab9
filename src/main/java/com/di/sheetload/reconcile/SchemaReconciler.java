package com.di.sheetload.reconcile;

import com.di.sheetload.exception.AnchorNotFoundException;
import com.di.sheetload.exception.PositionalDriftException;
import com.di.sheetload.exception.SchemaTooNarrowException;
import com.di.sheetload.schema.AnchorColumn;
import com.di.sheetload.schema.FieldSpec;
import com.di.sheetload.schema.SourceProfile;
import com.di.sheetload.schema.TargetSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps a drifted source header onto the fixed target field list.
 *
 * <p>Two phases per target field: an exact header-name match, then the field's canonical position.
 * The positional phase relies on deliveries only ever appending columns after the known core.
 * Both signals are cross-checked and any disagreement raises {@link PositionalDriftException}:
 * <ul>
 *   <li>a field found by name at a position other than its canonical one;</li>
 *   <li>a field not found by name whose canonical column is labelled as a different target field.</li>
 * </ul>
 * Anchor columns are located separately by alias, wherever they are.
 */
@Slf4j
@Component
public class SchemaReconciler {

    public ColumnMapping reconcile(SourceProfile profile, TargetSchema schema, List<AnchorColumn> anchors,
                                   int headerRowNumber) {
        Map<String, Integer> anchorPositions = locateAnchors(profile, anchors, headerRowNumber);

        int width = profile.getColumnCount();
        int required = schema.requiredFieldCount();
        if (width < required) {
            log.error("[RECONCILE] {} | source columns={} < required target fields={}",
                    profile.getSourceName(), width, required);
            throw new SchemaTooNarrowException(width, required, null);
        }

        Map<String, Integer> caseInsensitive = caseInsensitivePositions(profile);
        List<Integer> mapping = new ArrayList<>(schema.size());
        List<String> absent = new ArrayList<>();
        int byName = 0;
        int byPosition = 0;

        for (int i = 0; i < schema.size(); i++) {
            FieldSpec field = schema.field(i);
            Optional<Integer> named = findByName(profile, schema, caseInsensitive, field, i);
            if (named.isPresent()) {
                int position = named.get();
                if (position != i) {
                    throw new PositionalDriftException(field.name(), i, position,
                            String.format("header '%s' was found at column %d", field.header(), position));
                }
                mapping.add(position);
                byName++;
            } else if (i < width) {
                String label = profile.headerAt(i);
                Optional<Integer> owner = schema.indexOfHeader(label);
                if (owner.isPresent() && owner.get() != i) {
                    throw new PositionalDriftException(field.name(), i, i, String.format(
                            "column %d is labelled '%s', which belongs to target field '%s'",
                            i, label, schema.field(owner.get()).name()));
                }
                log.debug("[RECONCILE] field '{}' taken by position {} (source header '{}')", field.name(), i, label);
                mapping.add(i);
                byPosition++;
            } else if (field.nullable()) {
                mapping.add(ColumnMapping.ABSENT);
                absent.add(field.name());
            } else {
                throw new SchemaTooNarrowException(width, required, String.format(
                        "required field '%s' at position %d has no source column", field.name(), i));
            }
        }

        Set<Integer> used = new HashSet<>(mapping);
        Map<Integer, String> ignored = new LinkedHashMap<>();
        for (int p = 0; p < width; p++) {
            if (!used.contains(p)) {
                String label = profile.headerAt(p);
                ignored.put(p, label.isEmpty() ? "#" + p : label);
            }
        }

        log.info("[RECONCILE] {} | target fields={} | byName={} | byPosition={} | absent={} | ignored source columns={} | anchors={}",
                profile.getSourceName(), schema.size(), byName, byPosition, absent.size(), ignored.size(), anchorPositions);
        return ColumnMapping.builder()
                .sourceIndexByTarget(Collections.unmodifiableList(mapping))
                .anchorPositions(Collections.unmodifiableMap(anchorPositions))
                .ignoredColumns(Collections.unmodifiableMap(ignored))
                .absentFields(List.copyOf(absent))
                .matchedByName(byName)
                .matchedByPosition(byPosition)
                .build();
    }

    private Map<String, Integer> locateAnchors(SourceProfile profile, List<AnchorColumn> anchors, int headerRowNumber) {
        Map<String, Integer> positions = new LinkedHashMap<>();
        for (AnchorColumn anchor : anchors) {
            Integer found = null;
            for (int p = 0; p < profile.getColumnCount(); p++) {
                if (anchor.matches(profile.headerAt(p))) {
                    if (found == null) {
                        found = p;
                    } else {
                        log.warn("[RECONCILE] anchor '{}' also matches column {} ('{}'); using column {}",
                                anchor.name(), p, profile.headerAt(p), found);
                    }
                }
            }
            if (found != null) {
                positions.put(anchor.name(), found);
            } else if (anchor.required()) {
                throw new AnchorNotFoundException(anchor.name(), anchor.aliases(), headerRowNumber);
            } else {
                log.warn("[RECONCILE] optional anchor '{}' not present in {}", anchor.name(), profile.getSourceName());
            }
        }
        return positions;
    }

    private Optional<Integer> findByName(SourceProfile profile, TargetSchema schema,
                                         Map<String, Integer> caseInsensitive, FieldSpec field, int fieldIndex) {
        Optional<Integer> exact = profile.positionOf(field.header());
        if (exact.isPresent()) {
            return exact;
        }
        Integer folded = caseInsensitive.get(field.header().toLowerCase(Locale.ROOT));
        if (folded == null) {
            return Optional.empty();
        }
        // a differently-cased label that is itself another field's exact header is not a match
        Optional<Integer> owner = schema.indexOfHeader(profile.headerAt(folded));
        return owner.isPresent() && owner.get() != fieldIndex ? Optional.empty() : Optional.of(folded);
    }

    private Map<String, Integer> caseInsensitivePositions(SourceProfile profile) {
        Map<String, Integer> positions = new HashMap<>();
        Set<String> ambiguous = new HashSet<>();
        profile.getColumnPositions().forEach((label, position) -> {
            String key = label.toLowerCase(Locale.ROOT);
            if (positions.putIfAbsent(key, position) != null) {
                ambiguous.add(key);
            }
        });
        ambiguous.forEach(positions::remove);
        return positions;
    }
}
