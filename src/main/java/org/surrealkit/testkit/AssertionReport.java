package org.surrealkit.testkit;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record AssertionReport(String name, boolean passed, String message) {
    public AssertionReport {
        Objects.requireNonNull(name, "name");
        message = Objects.requireNonNullElse(message, "");
    }

    public static AssertionReport pass(final String name, final String message) {
        return new AssertionReport(name, true, message);
    }

    public static AssertionReport fail(final String name, final String message) {
        return new AssertionReport(name, false, message);
    }

    Map<String, Object> toMap() {
        final Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("passed", passed);
        map.put("message", message);
        return map;
    }
}
