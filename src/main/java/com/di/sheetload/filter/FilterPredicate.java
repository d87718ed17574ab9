package com.di.sheetload.filter;

import java.util.List;

/**
 * One declarative filter predicate over an anchor column.
 *
 * @param anchor   name of the anchor column the predicate reads
 * @param operator predicate kind
 * @param operands trimmed operand values; empty for {@code not-null}
 */
public record FilterPredicate(String anchor, PredicateOperator operator, List<String> operands) {

    public FilterPredicate {
        if (anchor == null || anchor.isBlank()) {
            throw new IllegalArgumentException("Predicate anchor cannot be null or blank");
        }
        if (operator == null) {
            throw new IllegalArgumentException("Predicate operator cannot be null");
        }
        operands = operands == null ? List.of() : operands.stream().map(String::trim).toList();
        operator.checkArity(operands);
    }

    public static FilterPredicate equalsTo(String anchor, String value) {
        return new FilterPredicate(anchor, PredicateOperator.EQUALS, List.of(value));
    }

    public static FilterPredicate notNull(String anchor) {
        return new FilterPredicate(anchor, PredicateOperator.NOT_NULL, List.of());
    }

    public static FilterPredicate inSet(String anchor, List<String> values) {
        return new FilterPredicate(anchor, PredicateOperator.IN_SET, values);
    }

    /** Reason recorded for a row that has a value but fails this predicate. */
    public String failureReason() {
        return "predicate-failed:" + anchor + " " + operator.label() + " " + operands;
    }
}
