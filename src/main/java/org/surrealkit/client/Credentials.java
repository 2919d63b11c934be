package org.surrealkit.client;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Signin credentials for one of the server's authentication levels.
 */
public record Credentials(
        Level level,
        String namespace,
        String database,
        String username,
        String password,
        String access,
        Map<String, Object> params) {
    public Credentials {
        Objects.requireNonNull(level, "level");
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public static Credentials root(final String username, final String password) {
        return new Credentials(Level.ROOT, null, null, username, password, null, null);
    }

    public static Credentials namespace(final String namespace, final String username, final String password) {
        return new Credentials(Level.NAMESPACE, namespace, null, username, password, null, null);
    }

    public static Credentials database(
            final String namespace,
            final String database,
            final String username,
            final String password) {
        return new Credentials(Level.DATABASE, namespace, database, username, password, null, null);
    }

    public static Credentials record(
            final String namespace,
            final String database,
            final String access,
            final Map<String, Object> params) {
        return new Credentials(Level.RECORD, namespace, database, null, null, access, params);
    }

    /**
     * Body of an HTTP {@code /signin} request.
     */
    public Map<String, Object> toSigninBody() {
        final Map<String, Object> body = new LinkedHashMap<>();
        switch (level) {
            case ROOT -> {
                body.put("user", username);
                body.put("pass", password);
            }
            case NAMESPACE -> {
                body.put("ns", namespace);
                body.put("user", username);
                body.put("pass", password);
            }
            case DATABASE -> {
                body.put("ns", namespace);
                body.put("db", database);
                body.put("user", username);
                body.put("pass", password);
            }
            case RECORD -> {
                body.putAll(params);
                body.put("ns", namespace);
                body.put("db", database);
                body.put("ac", access);
            }
        }
        return body;
    }

    @Override
    public String toString() {
        return "Credentials{level=" + level + ", namespace=" + namespace + ", database=" + database
                + ", username=" + username + ", access=" + access + "}";
    }

    public enum Level {
        ROOT,
        NAMESPACE,
        DATABASE,
        RECORD
    }
}
