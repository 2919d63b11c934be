package org.surrealkit.testkit;

import java.util.List;

public record PermissionsMatrixCase(
        String actor,
        String table,
        String recordId,
        List<PermissionRule> rules) implements CaseDefinition {
    public static final String LABEL = "permissions_matrix";
    static final String DEFAULT_RECORD_ID = "perm_record";

    public PermissionsMatrixCase {
        recordId = recordId == null || recordId.isBlank() ? DEFAULT_RECORD_ID : recordId.trim();
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    @Override
    public String label() {
        return LABEL;
    }
}
