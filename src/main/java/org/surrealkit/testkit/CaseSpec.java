package org.surrealkit.testkit;

import java.util.List;
import java.util.Objects;

public record CaseSpec(String name, List<String> tags, CaseDefinition definition) {
    public CaseSpec {
        Objects.requireNonNull(name, "name");
        tags = tags == null ? List.of() : List.copyOf(tags);
        Objects.requireNonNull(definition, "definition");
    }

    public String kind() {
        return definition.label();
    }
}
