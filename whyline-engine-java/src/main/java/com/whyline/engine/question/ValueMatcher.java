package com.whyline.engine.question;

import com.whyline.recorder.ValuePlaceholder;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;

/**
 * Equality between a recorded value and a value asked about. Numbers compare by value
 * across boxed types ({@code 8} matches {@code 8L} and {@code 8.0}); placeholders match
 * their rendering or type name; characters match one-character strings.
 */
public final class ValueMatcher {

    private ValueMatcher() {}

    public static boolean matches(Object recorded, Object expected) {
        if (Objects.equals(recorded, expected)) return true;
        if (recorded instanceof Number a && expected instanceof Number b) {
            return numericEquals(a, b);
        }
        if (recorded instanceof ValuePlaceholder placeholder && expected instanceof String text) {
            return text.equals(placeholder.toString()) || placeholder.isOfType(text);
        }
        if (recorded instanceof Character c && expected instanceof String text) {
            return text.equals(c.toString());
        }
        return false;
    }

    /** Whether any value of {@code values} matches {@code expected}. */
    public static boolean containsMatch(Map<String, Object> values, Object expected) {
        for (Object value : values.values()) {
            if (matches(value, expected)) return true;
        }
        return false;
    }

    static boolean numericEquals(Number a, Number b) {
        try {
            return toBigDecimal(a).compareTo(toBigDecimal(b)) == 0;
        } catch (NumberFormatException e) {
            // NaN and infinities have no BigDecimal form
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal d) return d;
        if (n instanceof BigInteger i) return new BigDecimal(i);
        if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
            return BigDecimal.valueOf(n.longValue());
        }
        return new BigDecimal(n.toString());
    }
}
