package org.surrealkit.client;

/**
 * A statement, signin or transport call against the database failed.
 */
public final class QueryExecutionException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final int statementIndex;

    public QueryExecutionException(final String message) {
        this(message, -1, null);
    }

    public QueryExecutionException(final String message, final Throwable cause) {
        this(message, -1, cause);
    }

    public QueryExecutionException(final String message, final int statementIndex, final Throwable cause) {
        super(message, cause);
        this.statementIndex = statementIndex;
    }

    /**
     * Zero-based index of the failing statement, or {@code -1} when unknown.
     */
    public int statementIndex() {
        return statementIndex;
    }

    /**
     * Wraps {@code cause} with operation context, keeping the statement index.
     */
    public static QueryExecutionException wrap(final String context, final RuntimeException cause) {
        final int index = cause instanceof QueryExecutionException query ? query.statementIndex : -1;
        return new QueryExecutionException(context + ": " + cause.getMessage(), index, cause);
    }
}
