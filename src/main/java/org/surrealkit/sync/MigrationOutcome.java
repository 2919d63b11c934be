package org.surrealkit.sync;

import java.util.Locale;

public enum MigrationOutcome {
    APPLIED,
    SKIPPED,
    PLANNED,
    FAILED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
