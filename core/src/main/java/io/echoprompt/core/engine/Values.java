package io.echoprompt.core.engine;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Value coercions shared by the built-in operators and the renderer. */
final class Values {

    // Leading decimal literal, as accepted by a lenient string-to-float parse.
    private static final Pattern LEADING_NUMBER =
            Pattern.compile("^\\s*[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private Values() {}

    /**
     * Parses the numeric prefix of a string ({@code "42px"} is 42), passes
     * numbers through, and returns {@code NaN} for anything else.
     */
    static double toNumber(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            Matcher matcher = LEADING_NUMBER.matcher(text);
            if (matcher.lookingAt()) {
                return Double.parseDouble(matcher.group().trim());
            }
        }
        return Double.NaN;
    }

    /** Formats a number without a trailing {@code .0} when it is integral. */
    static String formatNumber(Number number) {
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d)) {
                return "NaN";
            }
            if (Double.isInfinite(d)) {
                return d > 0 ? "Infinity" : "-Infinity";
            }
            if (d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            return new BigDecimal(Double.toString(d)).stripTrailingZeros().toPlainString();
        }
        if (number instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        return number.toString();
    }

    /** Compact textual form used for case-insensitive list comparisons. */
    static String displayString(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number number) {
            return formatNumber(number);
        }
        List<Object> items = asList(value);
        if (items != null) {
            StringBuilder joined = new StringBuilder();
            for (int i = 0; i < items.size(); i++) {
                if (i > 0) {
                    joined.append(',');
                }
                joined.append(items.get(i) == null ? "" : displayString(items.get(i)));
            }
            return joined.toString();
        }
        return value.toString();
    }

    /** Views a collection or array as a list; returns {@code null} for anything else. */
    static List<Object> asList(Object value) {
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> items = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                items.add(Array.get(value, i));
            }
            return items;
        }
        return null;
    }

    /** {@code true} for null, empty strings, empty collections, maps and arrays. */
    static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence text) {
            return text.length() == 0;
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        return value.getClass().isArray() && Array.getLength(value) == 0;
    }
}
