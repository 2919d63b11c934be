package org.surrealkit.testkit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one suite run against its isolated namespace/database pair.
 */
public record SuiteReport(
        String suiteFile,
        String suiteName,
        String namespace,
        String database,
        long durationMs,
        List<CaseReport> cases) {

    public SuiteReport {
        Objects.requireNonNull(suiteFile, "suiteFile");
        Objects.requireNonNull(suiteName, "suiteName");
        cases = cases == null ? List.of() : List.copyOf(cases);
    }

    public int casesTotal() {
        return cases.size();
    }

    public int casesFailed() {
        int failed = 0;
        for (final CaseReport report : cases) {
            if (!report.passed()) {
                failed++;
            }
        }
        return failed;
    }

    public int casesPassed() {
        return casesTotal() - casesFailed();
    }

    public boolean failed() {
        return casesFailed() > 0;
    }

    Map<String, Object> toMap() {
        final Map<String, Object> map = new LinkedHashMap<>();
        map.put("suiteFile", suiteFile);
        map.put("suiteName", suiteName);
        map.put("namespace", namespace);
        map.put("database", database);
        map.put("durationMs", durationMs);
        map.put("casesTotal", casesTotal());
        map.put("casesPassed", casesPassed());
        map.put("casesFailed", casesFailed());
        final List<Map<String, Object>> items = new ArrayList<>(cases.size());
        for (final CaseReport report : cases) {
            items.add(report.toMap());
        }
        map.put("cases", items);
        return map;
    }
}
