package org.surrealkit.testkit;

import java.util.List;

public record SchemaBehaviorCase(
        String actor,
        List<String> setupSql,
        String actionSql,
        boolean expectSuccess,
        String expectErrorContains,
        String verifySql,
        List<JsonAssertionSpec> assertions) implements CaseDefinition {
    public static final String LABEL = "schema_behavior";

    public SchemaBehaviorCase {
        setupSql = setupSql == null ? List.of() : List.copyOf(setupSql);
        assertions = assertions == null ? List.of() : List.copyOf(assertions);
    }

    @Override
    public String label() {
        return LABEL;
    }
}
