package com.fw24.framework.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Converts raw string values, typically taken from a URL query string, into the
 * closest matching Java type. Only numbers, booleans and {@code null} are recognized;
 * everything else is returned unchanged.
 */
public final class ValueParsingUtils {

    private static final Pattern BOOLEAN_PATTERN = Pattern.compile("^(true|false)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern INTEGER_PATTERN = Pattern.compile("^-?\\d{1,9}$");
    private static final Pattern LONG_PATTERN = Pattern.compile("^-?\\d{10,18}$");
    private static final Pattern DECIMAL_PATTERN = Pattern.compile("^-?\\d+\\.\\d+$");

    private ValueParsingUtils() {
    }

    public static Object parseValue(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return value;
        }
        if ("null".equals(trimmed)) {
            return null;
        }
        if (BOOLEAN_PATTERN.matcher(trimmed).matches()) {
            return Boolean.parseBoolean(trimmed);
        }
        if (INTEGER_PATTERN.matcher(trimmed).matches()) {
            return Integer.parseInt(trimmed);
        }
        if (LONG_PATTERN.matcher(trimmed).matches()) {
            return Long.parseLong(trimmed);
        }
        if (DECIMAL_PATTERN.matcher(trimmed).matches()) {
            return Double.parseDouble(trimmed);
        }
        return value;
    }

    /**
     * Parses the value when it is a string, recursing into collections. Non-string
     * values pass through untouched.
     */
    public static Object parseLooseValue(Object value) {
        if (value instanceof String s) {
            return parseValue(s);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> parsed = new ArrayList<>(collection.size());
            for (Object item : collection) {
                parsed.add(parseLooseValue(item));
            }
            return parsed;
        }
        return value;
    }
}
