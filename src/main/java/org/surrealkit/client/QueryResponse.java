package org.surrealkit.client;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered per-statement results of one executed batch.
 */
public final class QueryResponse {
    private final List<StatementResult> results;

    public QueryResponse(final List<StatementResult> results) {
        this.results = List.copyOf(Objects.requireNonNull(results, "results"));
    }

    public static QueryResponse of(final StatementResult... results) {
        return new QueryResponse(List.of(results));
    }

    public List<StatementResult> results() {
        return results;
    }

    public int size() {
        return results.size();
    }

    public Optional<StatementResult> firstError() {
        for (final StatementResult result : results) {
            if (!result.ok()) {
                return Optional.of(result);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns this response, or throws for the first failed statement.
     */
    public QueryResponse check() {
        for (int i = 0; i < results.size(); i++) {
            final StatementResult result = results.get(i);
            if (!result.ok()) {
                throw new QueryExecutionException(result.error(), i, null);
            }
        }
        return this;
    }

    /**
     * Result value of statement {@code index}; fails if that statement errored or does not exist.
     */
    public Object take(final int index) {
        if (index < 0 || index >= results.size()) {
            throw new QueryExecutionException(
                    "statement index " + index + " out of range (" + results.size() + " results)");
        }
        final StatementResult result = results.get(index);
        if (!result.ok()) {
            throw new QueryExecutionException(result.error(), index, null);
        }
        return result.result();
    }

    /**
     * Result of statement {@code index} as a list of rows; a single value becomes a one-row list
     * and {@code null} an empty list.
     */
    public List<Object> rows(final int index) {
        final Object value = take(index);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        final List<Object> single = new ArrayList<>(1);
        single.add(value);
        return single;
    }

    /**
     * Value of the whole batch for assertions: the single result when one statement ran,
     * otherwise the list of all results.
     */
    public Object value() {
        if (results.size() == 1) {
            return take(0);
        }
        final List<Object> values = new ArrayList<>(results.size());
        for (int i = 0; i < results.size(); i++) {
            values.add(take(i));
        }
        return values;
    }
}
