package org.surrealkit.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Conversions between JSON text and plain Java value trees.
 *
 * <p>Parsing is strict RFC 8259 JSON: unquoted names, single quotes, trailing commas, comments
 * and trailing content are rejected. Values come back as {@link Map}, {@link List},
 * {@link String}, {@link Number}, {@link Boolean} and {@code null}; integers keep their full
 * range as {@code Integer}, {@code Long} or {@code BigInteger}.
 */
public final class JsonValues {
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    private JsonValues() {
    }

    /**
     * Parses any JSON value (object, array or scalar).
     *
     * @throws IllegalArgumentException when the text is blank or not valid JSON
     */
    public static Object parse(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isBlank()) {
            throw new IllegalArgumentException("JSON text is empty");
        }
        try {
            return MAPPER.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses a JSON document whose root must be an object.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> parseObject(String text) {
        Object parsed = parse(text);
        if (!(parsed instanceof Map<?, ?>)) {
            throw new IllegalArgumentException("JSON root must be an object");
        }
        return (Map<String, Object>) parsed;
    }

    /**
     * Copies an arbitrary value tree (as produced by SnakeYAML or the TOML reader) into
     * string-keyed maps and lists.
     */
    public static Object normalize(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), normalize(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object item : collection) {
                copy.add(normalize(item));
            }
            return copy;
        }
        return value;
    }

    /**
     * Renders a value as assertion text: strings render as their bare content, everything else
     * as compact JSON.
     */
    public static String toText(Object value) {
        if (value instanceof String s) {
            return s;
        }
        return JsonEncoder.encode(value);
    }

    /**
     * Deep structural equality; numbers compare by numeric value regardless of boxed type.
     */
    public static boolean deepEquals(Object left, Object right) {
        if (left == right) {
            return true;
        }
        if (left == null || right == null) {
            return false;
        }
        if (left instanceof Number leftNumber && right instanceof Number rightNumber) {
            return numericEquals(leftNumber, rightNumber);
        }
        if (left instanceof Map<?, ?> leftMap && right instanceof Map<?, ?> rightMap) {
            if (leftMap.size() != rightMap.size()) {
                return false;
            }
            for (Map.Entry<?, ?> entry : leftMap.entrySet()) {
                if (!rightMap.containsKey(entry.getKey())) {
                    return false;
                }
                if (!deepEquals(entry.getValue(), rightMap.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        if (left instanceof List<?> leftList && right instanceof List<?> rightList) {
            if (leftList.size() != rightList.size()) {
                return false;
            }
            for (int i = 0; i < leftList.size(); i++) {
                if (!deepEquals(leftList.get(i), rightList.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(left, right);
    }

    private static boolean numericEquals(Number left, Number right) {
        try {
            BigDecimal leftDecimal = new BigDecimal(left.toString());
            BigDecimal rightDecimal = new BigDecimal(right.toString());
            return leftDecimal.compareTo(rightDecimal) == 0;
        } catch (NumberFormatException ignored) {
            return Objects.equals(left, right);
        }
    }
}
