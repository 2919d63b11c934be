package org.surrealkit.testkit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregate of one test run; all counts are folded from the suite reports.
 */
public record RunReport(
        String runId,
        Instant startedAt,
        Instant finishedAt,
        long durationMs,
        List<SuiteReport> suites) {

    public RunReport {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(finishedAt, "finishedAt");
        suites = suites == null ? List.of() : List.copyOf(suites);
    }

    public int suitesTotal() {
        return suites.size();
    }

    public int suitesFailed() {
        int failed = 0;
        for (final SuiteReport suite : suites) {
            if (suite.failed()) {
                failed++;
            }
        }
        return failed;
    }

    public int casesTotal() {
        int total = 0;
        for (final SuiteReport suite : suites) {
            total += suite.casesTotal();
        }
        return total;
    }

    public int casesPassed() {
        int passed = 0;
        for (final SuiteReport suite : suites) {
            passed += suite.casesPassed();
        }
        return passed;
    }

    public int casesFailed() {
        return casesTotal() - casesPassed();
    }

    public boolean successful() {
        return casesFailed() == 0;
    }

    public Map<String, Object> toMap() {
        final Map<String, Object> map = new LinkedHashMap<>();
        map.put("runId", runId);
        map.put("startedAt", startedAt.toString());
        map.put("finishedAt", finishedAt.toString());
        map.put("durationMs", durationMs);
        map.put("suitesTotal", suitesTotal());
        map.put("suitesFailed", suitesFailed());
        map.put("casesTotal", casesTotal());
        map.put("casesPassed", casesPassed());
        map.put("casesFailed", casesFailed());
        final List<Map<String, Object>> items = new ArrayList<>(suites.size());
        for (final SuiteReport suite : suites) {
            items.add(suite.toMap());
        }
        map.put("suites", items);
        return map;
    }
}
