package org.surrealkit.client;

import java.util.Map;

/**
 * Authenticated connection to a SurrealDB server.
 *
 * <p>Transport and signin failures surface as {@link QueryExecutionException}; statement-level
 * errors are carried in the returned {@link QueryResponse} until {@link QueryResponse#check()}.
 */
public interface DatabaseClient extends AutoCloseable {
    /**
     * Signs in and returns the issued bearer token.
     */
    String signin(Credentials credentials);

    void authenticate(String token);

    void use(String namespace, String database);

    QueryResponse execute(String statement, Map<String, Object> bindings);

    default QueryResponse execute(final String statement) {
        return execute(statement, Map.of());
    }

    /**
     * Executes {@code statement} and fails on the first statement error.
     */
    default QueryResponse executeChecked(final String statement, final Map<String, Object> bindings) {
        return execute(statement, bindings).check();
    }

    default QueryResponse executeChecked(final String statement) {
        return executeChecked(statement, Map.of());
    }

    @Override
    void close();
}
