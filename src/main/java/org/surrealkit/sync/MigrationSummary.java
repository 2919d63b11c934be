package org.surrealkit.sync;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-file outcomes of one migrate run, in apply order.
 */
public record MigrationSummary(Map<String, MigrationOutcome> outcomes) {
    public MigrationSummary {
        outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    public List<String> paths(final MigrationOutcome outcome) {
        return outcomes.entrySet().stream()
                .filter(entry -> entry.getValue() == outcome)
                .map(Map.Entry::getKey)
                .toList();
    }

    public int count(final MigrationOutcome outcome) {
        return paths(outcome).size();
    }

    public boolean hasFailures() {
        return count(MigrationOutcome.FAILED) > 0;
    }
}
