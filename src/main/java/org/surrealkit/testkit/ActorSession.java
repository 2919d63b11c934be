package org.surrealkit.testkit;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.surrealkit.client.DatabaseClient;

/**
 * Authenticated database connection for one actor plus the HTTP headers its API requests carry.
 */
public final class ActorSession implements AutoCloseable {
    private final String name;
    private final DatabaseClient client;
    private final Map<String, String> headers;

    public ActorSession(final String name, final DatabaseClient client, final Map<String, String> headers) {
        this.name = Objects.requireNonNull(name, "name");
        this.client = Objects.requireNonNull(client, "client");
        this.headers = Collections.unmodifiableMap(new TreeMap<>(Objects.requireNonNull(headers, "headers")));
    }

    public String name() {
        return name;
    }

    public DatabaseClient client() {
        return client;
    }

    public Map<String, String> headers() {
        return headers;
    }

    @Override
    public void close() {
        client.close();
    }
}
