package org.surrealkit.testkit;

import java.util.List;

public record SchemaMetadataCase(
        String actor,
        String table,
        String sql,
        List<String> contains,
        List<JsonAssertionSpec> assertions) implements CaseDefinition {
    public static final String LABEL = "schema_metadata";

    public SchemaMetadataCase {
        contains = contains == null ? List.of() : List.copyOf(contains);
        assertions = assertions == null ? List.of() : List.copyOf(assertions);
    }

    @Override
    public String label() {
        return LABEL;
    }
}
