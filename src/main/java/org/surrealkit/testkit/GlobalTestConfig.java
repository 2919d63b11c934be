package org.surrealkit.testkit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Run-wide defaults plus actors and fixtures shared by every suite.
 */
public record GlobalTestConfig(
        String baseUrl,
        Long timeoutMs,
        Map<String, ActorSpec> actors,
        List<FixtureSpec> fixtures) {

    public GlobalTestConfig {
        actors = actors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(actors));
        fixtures = fixtures == null ? List.of() : List.copyOf(fixtures);
    }

    public static GlobalTestConfig empty() {
        return new GlobalTestConfig(null, null, Map.of(), List.of());
    }
}
