package org.surrealkit.testkit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Strict reader over one decoded object. Unknown keys and type mismatches are recorded as
 * path-qualified errors in a list shared by the whole document; accessors then return
 * defaults so decoding can continue and report every issue at once.
 */
final class SpecReader {
    private final Map<String, Object> values;
    private final String path;
    private final List<String> errors;

    private SpecReader(final Map<String, Object> values, final String path, final List<String> errors) {
        this.values = values;
        this.path = path;
        this.errors = errors;
    }

    /**
     * Reader over {@code value}, rejecting keys outside {@code allowedKeys}. A non-object value
     * is recorded as an error and read as an empty object.
     */
    static SpecReader of(
            final Object value,
            final String path,
            final List<String> errors,
            final Set<String> allowedKeys) {
        final Map<String, Object> values = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            for (final Map.Entry<?, ?> entry : map.entrySet()) {
                values.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        } else {
            errors.add(describe(path) + " must be an object");
        }
        for (final String key : new TreeSet<>(values.keySet())) {
            if (!allowedKeys.contains(key)) {
                errors.add("unknown field " + qualify(path, key));
            }
        }
        return new SpecReader(values, path, errors);
    }

    String path() {
        return path;
    }

    String field(final String key) {
        return qualify(path, key);
    }

    boolean has(final String key) {
        return values.containsKey(key);
    }

    Object raw(final String key) {
        return values.get(key);
    }

    void error(final String message) {
        errors.add(message);
    }

    String optionalString(final String key) {
        final Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            errors.add(field(key) + " must be a string");
            return null;
        }
        return text;
    }

    String requiredString(final String key) {
        final Object value = values.get(key);
        if (value != null && !(value instanceof String)) {
            errors.add(field(key) + " must be a string");
            return "";
        }
        if (value == null || ((String) value).isBlank()) {
            errors.add(field(key) + " is required");
            return "";
        }
        return (String) value;
    }

    boolean bool(final String key, final boolean defaultValue) {
        final Boolean value = optionalBool(key);
        return value == null ? defaultValue : value;
    }

    Boolean optionalBool(final String key) {
        final Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Boolean flag)) {
            errors.add(field(key) + " must be a boolean");
            return null;
        }
        return flag;
    }

    Long optionalLong(final String key) {
        final Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number number) || number.doubleValue() != Math.rint(number.doubleValue())) {
            errors.add(field(key) + " must be an integer");
            return null;
        }
        if (number.longValue() < 0) {
            errors.add(field(key) + " must not be negative");
            return null;
        }
        return number.longValue();
    }

    List<String> stringList(final String key) {
        final List<String> result = new ArrayList<>();
        final List<Object> items = list(key);
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) instanceof String text) {
                result.add(text);
            } else {
                errors.add(field(key) + "[" + i + "] must be a string");
            }
        }
        return result;
    }

    Map<String, String> stringMap(final String key) {
        final Map<String, String> result = new LinkedHashMap<>();
        final Object value = values.get(key);
        if (value == null) {
            return result;
        }
        if (!(value instanceof Map<?, ?> map)) {
            errors.add(field(key) + " must be an object");
            return result;
        }
        for (final Map.Entry<?, ?> entry : map.entrySet()) {
            final String name = String.valueOf(entry.getKey());
            if (entry.getValue() instanceof String text) {
                result.put(name, text);
            } else {
                errors.add(qualify(field(key), name) + " must be a string");
            }
        }
        return result;
    }

    Map<String, Object> optionalObject(final String key) {
        final Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map<?, ?> map)) {
            errors.add(field(key) + " must be an object");
            return null;
        }
        final Map<String, Object> result = new LinkedHashMap<>();
        for (final Map.Entry<?, ?> entry : map.entrySet()) {
            result.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return result;
    }

    List<Object> list(final String key) {
        final Object value = values.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            errors.add(field(key) + " must be an array");
            return List.of();
        }
        return new ArrayList<>(list);
    }

    static String qualify(final String path, final String key) {
        return path == null || path.isEmpty() ? key : path + "." + key;
    }

    private static String describe(final String path) {
        return path == null || path.isEmpty() ? "document root" : path;
    }
}
