package io.mnemos.core.tool;

import io.mnemos.core.graph.ValidationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lenient accessors for model-supplied tool input. Models send numbers as strings and lists as single values
 * often enough that handlers coerce instead of rejecting.
 */
final class ToolInputs {

    private ToolInputs() {
    }

    static String string(Map<String, Object> input, String key, String fallback) {
        Object value = input.get(key);
        if (value == null) {
            return fallback;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? fallback : text;
    }

    static String required(Map<String, Object> input, String key) {
        String value = string(input, key, null);
        if (value == null) {
            throw new ValidationException(key + " is required");
        }
        return value;
    }

    static int integer(Map<String, Object> input, String key, int fallback) {
        Object value = input.get(key);
        if (value instanceof Number number) {
            return number.intValue() > 0 ? number.intValue() : fallback;
        }
        if (value == null) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(String.valueOf(value).trim());
            return parsed > 0 ? parsed : fallback;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    static double decimal(Map<String, Object> input, String key, double fallback) {
        Object value = input.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    static boolean bool(Map<String, Object> input, String key, boolean fallback) {
        Object value = input.get(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        return value == null ? fallback : Boolean.parseBoolean(String.valueOf(value).trim());
    }

    static List<String> strings(Map<String, Object> input, String key) {
        Object value = input.get(key);
        if (value == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                String token = item == null ? "" : String.valueOf(item).trim();
                if (!token.isBlank()) {
                    out.add(token);
                }
            }
        } else {
            for (String token : String.valueOf(value).split(",")) {
                if (!token.isBlank()) {
                    out.add(token.trim());
                }
            }
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> map(Map<String, Object> input, String key) {
        Object value = input.get(key);
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            ((Map<Object, Object>) map).forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        }
        return new LinkedHashMap<>();
    }
}
