package org.surrealkit.json;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Deterministic JSON writer for plain Java value trees (maps, lists, strings, numbers, booleans).
 *
 * <p>Object keys are always emitted in sorted order so identical trees encode to identical text.
 */
public final class JsonEncoder {
    private static final String INDENT = "  ";

    private JsonEncoder() {
    }

    public static String encode(Object value) {
        StringBuilder sb = new StringBuilder();
        appendValue(sb, value, -1);
        return sb.toString();
    }

    public static String encodePretty(Object value) {
        StringBuilder sb = new StringBuilder();
        appendValue(sb, value, 0);
        return sb.toString();
    }

    @SuppressWarnings("unchecked")
    private static void appendValue(StringBuilder sb, Object value, int depth) {
        if (value == null) {
            sb.append("null");
            return;
        }
        if (value instanceof String s) {
            appendString(sb, s);
            return;
        }
        if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
            sb.append("null");
            return;
        }
        if (value instanceof Number || value instanceof Boolean) {
            sb.append(value);
            return;
        }
        if (value instanceof Map<?, ?> map) {
            appendObject(sb, (Map<Object, Object>) map, depth);
            return;
        }
        if (value instanceof Collection<?> collection) {
            appendArray(sb, collection, depth);
            return;
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> boxed = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                boxed.add(Array.get(value, i));
            }
            appendArray(sb, boxed, depth);
            return;
        }
        if (value instanceof Date date) {
            appendString(sb, date.toInstant().toString());
            return;
        }
        appendString(sb, String.valueOf(value));
    }

    private static void appendObject(StringBuilder sb, Map<Object, Object> map, int depth) {
        Map<String, Object> normalized = normalizeKeyMap(map);
        if (normalized.isEmpty()) {
            sb.append("{}");
            return;
        }
        sb.append('{');
        boolean first = true;
        for (String key : new TreeSet<>(normalized.keySet())) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            newline(sb, depth < 0 ? -1 : depth + 1);
            appendString(sb, key);
            sb.append(depth < 0 ? ":" : ": ");
            appendValue(sb, normalized.get(key), depth < 0 ? -1 : depth + 1);
        }
        newline(sb, depth);
        sb.append('}');
    }

    private static void appendArray(StringBuilder sb, Collection<?> values, int depth) {
        if (values.isEmpty()) {
            sb.append("[]");
            return;
        }
        sb.append('[');
        boolean first = true;
        for (Object item : values) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            newline(sb, depth < 0 ? -1 : depth + 1);
            appendValue(sb, item, depth < 0 ? -1 : depth + 1);
        }
        newline(sb, depth);
        sb.append(']');
    }

    private static void newline(StringBuilder sb, int depth) {
        if (depth < 0) {
            return;
        }
        sb.append('\n');
        sb.append(INDENT.repeat(depth));
    }

    private static void appendString(StringBuilder sb, String value) {
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c <= 0x1F) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }

    private static Map<String, Object> normalizeKeyMap(Map<Object, Object> source) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        for (Map.Entry<Object, Object> entry : source.entrySet()) {
            normalized.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return normalized;
    }
}
