package org.surrealkit.schema;

import java.util.Locale;
import java.util.Optional;

/**
 * Schema entity kinds recognised in {@code DEFINE} statements.
 */
public enum EntityKind {
    TABLE("table", ScopeRule.NONE),
    FIELD("field", ScopeRule.REQUIRED),
    EVENT("event", ScopeRule.REQUIRED),
    INDEX("index", ScopeRule.REQUIRED),
    FUNCTION("function", ScopeRule.NONE),
    PARAM("param", ScopeRule.NONE),
    ACCESS("access", ScopeRule.OPTIONAL),
    ANALYZER("analyzer", ScopeRule.NONE),
    USER("user", ScopeRule.OPTIONAL),
    API("api", ScopeRule.NONE);

    private final String value;
    private final ScopeRule scopeRule;

    EntityKind(final String value, final ScopeRule scopeRule) {
        this.value = value;
        this.scopeRule = scopeRule;
    }

    public String value() {
        return value;
    }

    public ScopeRule scopeRule() {
        return scopeRule;
    }

    public String keyword() {
        return value.toUpperCase(Locale.ROOT);
    }

    public static Optional<EntityKind> fromText(final String rawValue) {
        if (rawValue == null) {
            return Optional.empty();
        }
        final String value = rawValue.trim().toLowerCase(Locale.ROOT);
        for (final EntityKind kind : values()) {
            if (kind.value.equals(value)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Whether an entity of this kind is named relative to an owning scope.
     */
    public enum ScopeRule {
        NONE,
        REQUIRED,
        OPTIONAL
    }
}
