package org.surrealkit.sync;

/**
 * Pruning was refused because the database is marked shared.
 */
public final class SharedDatabaseException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public SharedDatabaseException(final String message) {
        super(message);
    }
}
