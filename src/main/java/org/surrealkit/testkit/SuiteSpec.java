package org.surrealkit.testkit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One suite document: optional display name, tags, actor overrides, fixtures and ordered cases.
 */
public record SuiteSpec(
        String name,
        List<String> tags,
        Map<String, ActorSpec> actors,
        List<FixtureSpec> fixtures,
        List<CaseSpec> cases) {

    public SuiteSpec {
        tags = tags == null ? List.of() : List.copyOf(tags);
        actors = actors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(actors));
        fixtures = fixtures == null ? List.of() : List.copyOf(fixtures);
        cases = cases == null ? List.of() : List.copyOf(cases);
    }

    public SuiteSpec withCases(final List<CaseSpec> retained) {
        return new SuiteSpec(name, tags, actors, fixtures, retained);
    }
}
