package org.surrealkit.testkit;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A parsed suite with its project-relative path and the directory its fixture files resolve
 * against.
 */
public record LoadedSuite(String path, Path directory, SuiteSpec spec) {
    public LoadedSuite {
        path = Objects.requireNonNull(path, "path").replace('\\', '/');
        Objects.requireNonNull(directory, "directory");
        Objects.requireNonNull(spec, "spec");
    }

    public String displayName() {
        return spec.name() == null || spec.name().isBlank() ? path : spec.name();
    }

    public LoadedSuite withCases(final List<CaseSpec> cases) {
        return new LoadedSuite(path, directory, spec.withCases(cases));
    }
}
