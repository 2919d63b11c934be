package org.surrealkit.testkit;

import java.util.List;
import java.util.Objects;

public record LoadedSpecs(GlobalTestConfig global, List<LoadedSuite> suites) {
    public LoadedSpecs {
        Objects.requireNonNull(global, "global");
        suites = List.copyOf(suites);
    }
}
