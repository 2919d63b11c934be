package org.surrealkit.testkit;

import java.util.List;

public record SqlExpectCase(
        String actor,
        String sql,
        boolean allow,
        String errorContains,
        String errorCode,
        List<JsonAssertionSpec> assertions) implements CaseDefinition {
    public static final String LABEL = "sql_expect";

    public SqlExpectCase {
        assertions = assertions == null ? List.of() : List.copyOf(assertions);
    }

    @Override
    public String label() {
        return LABEL;
    }
}
