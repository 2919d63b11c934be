package org.surrealkit.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonValuesTest {
    @Test
    void parsesScalarsArraysAndObjects() {
        assertEquals(42, JsonValues.parse("42"));
        assertEquals("ok", JsonValues.parse(" \"ok\" "));
        assertNull(JsonValues.parse("null"));
        assertEquals(List.of(1, true, "x"), JsonValues.parse("[1, true, \"x\"]"));
        assertEquals(Map.of("a", Map.of("b", List.of())), JsonValues.parse("{\"a\": {\"b\": []}}"));
    }

    @Test
    void rejectsInvalidJson() {
        assertThrows(IllegalArgumentException.class, () -> JsonValues.parse("   "));
        assertThrows(IllegalArgumentException.class, () -> JsonValues.parse("{\"a\":"));
        IllegalArgumentException notObject =
            assertThrows(IllegalArgumentException.class, () -> JsonValues.parseObject("[1]"));
        assertEquals("JSON root must be an object", notObject.getMessage());
    }

    @Test
    void rejectsRelaxedJsonSyntax() {
        assertThrows(IllegalArgumentException.class, () -> JsonValues.parse("{a: 1}"));
        assertThrows(IllegalArgumentException.class, () -> JsonValues.parse("'hello'"));
        assertThrows(IllegalArgumentException.class, () -> JsonValues.parse("[1, 2,]"));
        assertThrows(IllegalArgumentException.class, () -> JsonValues.parse("{\"a\": 1} trailing"));
    }

    @Test
    void keepsIntegersBeyondLongRange() {
        assertEquals(Map.of("n", new BigInteger("18446744073709551615")),
            JsonValues.parse("{\"n\": 18446744073709551615}"));
        assertEquals(9007199254740993L, JsonValues.parse("9007199254740993"));
    }

    @Test
    void dollarPrefixedKeysStayPlainObjects() {
        assertEquals(Map.of("$numberLong", "5"), JsonValues.parse("{\"$numberLong\": \"5\"}"));
        assertEquals(Map.of("when", Map.of("$date", 0)), JsonValues.parse("{\"when\": {\"$date\": 0}}"));
        assertEquals(Map.of("id", Map.of("$oid", "abc")), JsonValues.parse("{\"id\": {\"$oid\": \"abc\"}}"));
    }

    @Test
    void normalizeStringifiesKeys() {
        Map<Object, Object> source = new LinkedHashMap<>();
        source.put(1, List.of(Map.of(true, "yes")));

        assertEquals(Map.of("1", List.of(Map.of("true", "yes"))), JsonValues.normalize(source));
    }

    @Test
    void deepEqualsComparesNumbersByValue() {
        assertTrue(JsonValues.deepEquals(Map.of("n", 1), Map.of("n", 1.0d)));
        assertTrue(JsonValues.deepEquals(List.of(2L, "a"), List.of(2, "a")));
        assertFalse(JsonValues.deepEquals(List.of(1, 2), List.of(2, 1)));
        assertFalse(JsonValues.deepEquals(Map.of("n", 1), Map.of("m", 1)));
        assertFalse(JsonValues.deepEquals(null, List.of()));
    }

    @Test
    void toTextKeepsStringsBare() {
        assertEquals("plain", JsonValues.toText("plain"));
        assertEquals("{\"a\":[1,null]}", JsonValues.toText(Map.of("a", Arrays.asList(1, null))));
    }

    @Test
    void compactEncodingOfNestedValuesIsSingleLine() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("b", List.of(1, Map.of("c", List.of(true))));
        value.put("a", 1);

        String encoded = JsonEncoder.encode(value);

        assertEquals("{\"a\":1,\"b\":[1,{\"c\":[true]}]}", encoded);
        assertFalse(encoded.contains("\n"));
        assertTrue(JsonValues.toText(value).startsWith("{\"a\":1,\"b\""));
    }

    @Test
    void encoderSortsKeysAndEscapes() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("b", "line\n\"quoted\"");
        value.put("a", List.of(1, 2));

        assertEquals("{\"a\":[1,2],\"b\":\"line\\n\\\"quoted\\\"\"}", JsonEncoder.encode(value));
        assertEquals("{\n  \"a\": [\n    1,\n    2\n  ],\n  \"b\": {}\n}",
            JsonEncoder.encodePretty(Map.of("b", Map.of(), "a", List.of(1, 2))));
        assertEquals("null", JsonEncoder.encode(Double.NaN));
    }
}
