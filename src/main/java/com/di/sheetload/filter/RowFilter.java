package com.di.sheetload.filter;

import com.di.sheetload.reconcile.ColumnMapping;
import com.di.sheetload.schema.NullTokens;
import com.di.sheetload.source.SourceRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Applies an AND-combined predicate chain to source rows.
 *
 * <p>The result is a lazy, single-pass stream in source order. Evaluation is pure: the same rows,
 * mapping and chain always give the same verdicts. A row whose anchor cell is blank, a null token,
 * or outside the row is ineligible with reason {@value FilterOutcome#MISSING_ANCHOR_VALUE}; this
 * includes anchors that are optional and were not located in the header.
 */
@Slf4j
@Component
public class RowFilter {

    /**
     * Checks that every predicate refers to a declared anchor.
     *
     * @throws IllegalArgumentException for a predicate over an undeclared anchor
     */
    public void validateChain(List<FilterPredicate> chain, Collection<String> declaredAnchors) {
        Set<String> declared = Set.copyOf(declaredAnchors);
        for (FilterPredicate predicate : chain) {
            if (!declared.contains(predicate.anchor())) {
                throw new IllegalArgumentException(String.format(
                        "Filter predicate refers to undeclared anchor '%s'; declared anchors: %s",
                        predicate.anchor(), declared));
            }
        }
    }

    public Stream<FilterOutcome> apply(Stream<SourceRow> rows, ColumnMapping mapping,
                                       List<FilterPredicate> chain, NullTokens nullTokens) {
        List<FilterPredicate> predicates = List.copyOf(chain);
        log.debug("[FILTER] chain={} | anchors={}", predicates, mapping.getAnchorPositions());
        return rows.map(row -> evaluate(row, mapping, predicates, nullTokens));
    }

    FilterOutcome evaluate(SourceRow row, ColumnMapping mapping, List<FilterPredicate> chain, NullTokens nullTokens) {
        for (FilterPredicate predicate : chain) {
            Optional<Integer> position = mapping.anchorPosition(predicate.anchor());
            String raw = position.map(row::cell).orElse(null);
            if (nullTokens.isNull(raw)) {
                return FilterOutcome.reject(row, FilterOutcome.MISSING_ANCHOR_VALUE);
            }
            if (!predicate.operator().test(raw.trim(), predicate.operands())) {
                return FilterOutcome.reject(row, predicate.failureReason());
            }
        }
        return FilterOutcome.pass(row);
    }
}
