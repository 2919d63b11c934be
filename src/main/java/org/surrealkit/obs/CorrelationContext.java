package org.surrealkit.obs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Correlation metadata emitted with every structured log event: the run, the operation and,
 * where known, the suite, actor and schema path being worked on.
 */
public final class CorrelationContext {
    private final String runId;
    private final String operation;
    private final String suite;
    private final String actor;
    private final String path;

    private CorrelationContext(Builder builder) {
        this.runId = requireText(builder.runId, "runId");
        this.operation = requireText(builder.operation, "operation");
        this.suite = normalize(builder.suite);
        this.actor = normalize(builder.actor);
        this.path = normalize(builder.path);
    }

    public static CorrelationContext of(String runId, String operation) {
        return builder(runId, operation).build();
    }

    public static Builder builder(String runId, String operation) {
        return new Builder(runId, operation);
    }

    public Builder toBuilder() {
        return new Builder(runId, operation).suite(suite).actor(actor).path(path);
    }

    public CorrelationContext withPath(String path) {
        return toBuilder().path(path).build();
    }

    public CorrelationContext withSuite(String suite) {
        return toBuilder().suite(suite).build();
    }

    public String runId() {
        return runId;
    }

    public String operation() {
        return operation;
    }

    public Optional<String> suite() {
        return Optional.ofNullable(suite);
    }

    public Optional<String> actor() {
        return Optional.ofNullable(actor);
    }

    public Optional<String> path() {
        return Optional.ofNullable(path);
    }

    public Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("runId", runId);
        fields.put("operation", operation);
        if (suite != null) {
            fields.put("suite", suite);
        }
        if (actor != null) {
            fields.put("actor", actor);
        }
        if (path != null) {
            fields.put("path", path);
        }
        return fields;
    }

    private static String requireText(String value, String fieldName) {
        String normalized = normalize(value);
        if (normalized == null) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {
        private final String runId;
        private final String operation;
        private String suite;
        private String actor;
        private String path;

        private Builder(String runId, String operation) {
            this.runId = Objects.requireNonNull(runId, "runId");
            this.operation = Objects.requireNonNull(operation, "operation");
        }

        public Builder suite(String suite) {
            this.suite = suite;
            return this;
        }

        public Builder actor(String actor) {
            this.actor = actor;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public CorrelationContext build() {
            return new CorrelationContext(this);
        }
    }
}
