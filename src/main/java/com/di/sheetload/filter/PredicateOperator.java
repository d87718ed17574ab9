package com.di.sheetload.filter;

import java.util.List;
import java.util.Locale;

/**
 * Predicate kinds a filter chain can declare. Each constant evaluates a trimmed, non-null anchor
 * value against the predicate's operands; null values never reach {@link #test}.
 * <p>To add a kind: add a constant with its own {@code test} and operand arity.
 */
public enum PredicateOperator {

    EQUALS(1, 1) {
        @Override
        public boolean test(String value, List<String> operands) {
            return value.equals(operands.get(0));
        }
    },
    NOT_NULL(0, 0) {
        @Override
        public boolean test(String value, List<String> operands) {
            return true;
        }
    },
    IN_SET(1, Integer.MAX_VALUE) {
        @Override
        public boolean test(String value, List<String> operands) {
            return operands.contains(value);
        }
    };

    private final int minOperands;
    private final int maxOperands;

    PredicateOperator(int minOperands, int maxOperands) {
        this.minOperands = minOperands;
        this.maxOperands = maxOperands;
    }

    public abstract boolean test(String value, List<String> operands);

    public void checkArity(List<String> operands) {
        int count = operands == null ? 0 : operands.size();
        if (count < minOperands || count > maxOperands) {
            throw new IllegalArgumentException(String.format(
                    "Operator %s takes %s operand(s), got %d", name(),
                    minOperands == maxOperands ? String.valueOf(minOperands)
                            : minOperands + ".." + (maxOperands == Integer.MAX_VALUE ? "n" : maxOperands),
                    count));
        }
    }

    /** Config-friendly label: {@code in-set} for IN_SET. */
    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /** Accepts {@code EQUALS}, {@code equals}, {@code in-set}, {@code not_null} and so on. */
    public static PredicateOperator fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Predicate operator cannot be null or blank");
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown predicate operator: '" + label + "'", e);
        }
    }
}
