package org.surrealkit.testkit;

import java.util.Locale;

public enum ActorKind {
    ROOT("root"),
    NAMESPACE("namespace"),
    DATABASE("database"),
    RECORD("record"),
    TOKEN("token"),
    HEADERS("headers");

    private final String value;

    ActorKind(final String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    static ActorKind fromText(final String rawValue) {
        final String value = rawValue == null ? "" : rawValue.trim().toLowerCase(Locale.ROOT);
        for (final ActorKind kind : values()) {
            if (kind.value.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unsupported actor kind: " + rawValue);
    }
}
