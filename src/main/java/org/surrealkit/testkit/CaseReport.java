package org.surrealkit.testkit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one case. A case passes only when every assertion passed and no error occurred.
 */
public record CaseReport(
        String name,
        String kind,
        long durationMs,
        boolean passed,
        String message,
        List<AssertionReport> assertions) {

    public CaseReport {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        assertions = assertions == null ? List.of() : List.copyOf(assertions);
    }

    /**
     * Report whose verdict is folded from {@code assertions}; {@code failureMessage} is kept
     * only when one of them failed.
     */
    static CaseReport fromAssertions(
            final CaseSpec testCase,
            final List<AssertionReport> assertions,
            final String failureMessage) {
        final boolean passed = assertions.stream().allMatch(AssertionReport::passed);
        return new CaseReport(testCase.name(), testCase.kind(), 0L, passed, passed ? null : failureMessage, assertions);
    }

    /**
     * Report for a case that raised instead of producing a verdict.
     */
    static CaseReport error(final CaseSpec testCase, final String message, final long durationMs) {
        return new CaseReport(
                testCase.name(),
                testCase.kind(),
                durationMs,
                false,
                message,
                List.of(AssertionReport.fail("error", message)));
    }

    CaseReport withDuration(final long value) {
        return new CaseReport(name, kind, value, passed, message, assertions);
    }

    Map<String, Object> toMap() {
        final Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("kind", kind);
        map.put("durationMs", durationMs);
        map.put("passed", passed);
        map.put("message", message);
        final List<Map<String, Object>> items = new ArrayList<>(assertions.size());
        for (final AssertionReport assertion : assertions) {
            items.add(assertion.toMap());
        }
        map.put("assertions", items);
        return map;
    }
}
