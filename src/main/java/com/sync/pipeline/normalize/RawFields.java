package com.sync.pipeline.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Typed reads from vendor payloads. Malformed values raise {@link NormalizationException}.
 */
public final class RawFields {

    private RawFields() {
    }

    public static String requireString(Map<String, Object> raw, String field) {
        Object value = raw.get(field);
        if (!(value instanceof String text) || text.isBlank()) {
            throw new NormalizationException("Missing required field '" + field + "'");
        }
        return text;
    }

    public static String string(Map<String, Object> raw, String field) {
        Object value = raw.get(field);
        return value != null ? value.toString() : null;
    }

    public static boolean bool(Map<String, Object> raw, String field, boolean defaultValue) {
        Object value = raw.get(field);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String text) {
            return Boolean.parseBoolean(text);
        }
        return defaultValue;
    }

    public static long number(Map<String, Object> raw, String field) {
        Object value = raw.get(field);
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                throw new NormalizationException("Field '" + field + "' is not a number: " + text, e);
            }
        }
        return 0;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> object(Map<String, Object> raw, String field) {
        Object value = raw.get(field);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?>)) {
            throw new NormalizationException("Field '" + field + "' is not an object");
        }
        return (Map<String, Object>) value;
    }

    public static List<Object> list(Map<String, Object> raw, String field) {
        Object value = raw.get(field);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new NormalizationException("Field '" + field + "' is not a list");
        }
        return new ArrayList<>(list);
    }

    public static List<String> strings(Map<String, Object> raw, String field) {
        List<String> result = new ArrayList<>();
        for (Object element : list(raw, field)) {
            if (element != null) {
                result.add(element.toString());
            }
        }
        return result;
    }

    /**
     * Values of {@code key} in a list of objects, e.g. the skuIds of {@code assignedLicenses}.
     */
    @SuppressWarnings("unchecked")
    public static List<String> pluck(Map<String, Object> raw, String field, String key) {
        List<String> result = new ArrayList<>();
        for (Object element : list(raw, field)) {
            if (element instanceof Map<?, ?> map) {
                Object value = ((Map<String, Object>) map).get(key);
                if (value != null) {
                    result.add(value.toString());
                }
            }
        }
        return result;
    }
}
