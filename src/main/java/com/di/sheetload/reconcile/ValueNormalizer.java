package com.di.sheetload.reconcile;

import com.di.sheetload.schema.FieldSpec;
import com.di.sheetload.schema.NullTokens;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Turns raw cell text into the value bound for a field, following the field's semantic type.
 */
public class ValueNormalizer {

    private static final Pattern GROUPED_NUMBER = Pattern.compile("^-?\\d{1,3}(,\\d{3})+(\\.\\d+)?$");

    private final NullTokens nullTokens;
    private final int maxTextLength;

    public ValueNormalizer(NullTokens nullTokens, int maxTextLength) {
        if (maxTextLength < 1) {
            throw new IllegalArgumentException("Max text length must be positive, got: " + maxTextLength);
        }
        this.nullTokens = nullTokens;
        this.maxTextLength = maxTextLength;
    }

    /**
     * @return null for blank cells and null tokens, otherwise a {@code String}, {@code Long} or {@code BigDecimal}
     * @throws NumberFormatException if a numeric field holds text that is not a number of that type
     */
    public Object normalize(String raw, FieldSpec field) {
        if (nullTokens.isNull(raw)) {
            return null;
        }
        String value = raw.trim();
        switch (field.type()) {
            case INTEGER:
                return toLong(parseDecimal(value), value);
            case DECIMAL:
                return parseDecimal(value);
            case PERCENT:
                return parseDecimal(value.endsWith("%") ? value.substring(0, value.length() - 1).trim() : value);
            case TEXT:
            default:
                return value.length() > maxTextLength ? value.substring(0, maxTextLength) : value;
        }
    }

    private static BigDecimal parseDecimal(String value) {
        String candidate = GROUPED_NUMBER.matcher(value).matches() ? value.replace(",", "") : value;
        return new BigDecimal(candidate);
    }

    private static Long toLong(BigDecimal decimal, String raw) {
        try {
            return decimal.longValueExact();
        } catch (ArithmeticException e) {
            throw new NumberFormatException("Not a whole number: " + raw);
        }
    }
}
