package org.surrealkit.testkit;

import java.util.Objects;

public record PermissionRule(PermissionAction action, boolean allow, String sql, String errorContains) {
    public PermissionRule {
        Objects.requireNonNull(action, "action");
    }
}
