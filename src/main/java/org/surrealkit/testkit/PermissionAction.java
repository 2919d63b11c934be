package org.surrealkit.testkit;

import java.util.Locale;

public enum PermissionAction {
    CREATE,
    SELECT,
    UPDATE,
    DELETE,
    QUERY;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    static PermissionAction fromText(final String rawValue) {
        final String value = rawValue == null ? "" : rawValue.trim().toLowerCase(Locale.ROOT);
        for (final PermissionAction action : values()) {
            if (action.value().equals(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("unsupported permission action: " + rawValue);
    }
}
