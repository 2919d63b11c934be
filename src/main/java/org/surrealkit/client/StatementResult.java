package org.surrealkit.client;

import java.util.Objects;

/**
 * Outcome of one statement in a query batch: a result value, or an error message.
 */
public record StatementResult(boolean ok, Object result, String error) {
    public StatementResult {
        if (!ok) {
            Objects.requireNonNull(error, "error");
        }
    }

    public static StatementResult success(final Object result) {
        return new StatementResult(true, result, null);
    }

    public static StatementResult failure(final String error) {
        return new StatementResult(false, null, error);
    }
}
