package org.surrealkit.testkit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.surrealkit.client.Credentials;
import org.surrealkit.client.DatabaseClient;
import org.surrealkit.client.DatabaseClientFactory;
import org.surrealkit.client.QueryExecutionException;
import org.surrealkit.config.ConfigurationException;
import org.surrealkit.config.DatabaseSettings;

/**
 * The sessions of one suite run, keyed by actor name. Always contains {@value #ROOT}, signed
 * in with the operator's own credentials unless an actor of that name is declared.
 */
public final class ActorSessions implements AutoCloseable {
    public static final String ROOT = "root";
    static final String AUTHORIZATION_HEADER = "authorization";

    private final Map<String, ActorSession> sessions;

    private ActorSessions(final Map<String, ActorSession> sessions) {
        this.sessions = sessions;
    }

    /**
     * Suite actors override global actors of the same name.
     */
    public static Map<String, ActorSpec> merge(
            final Map<String, ActorSpec> global,
            final Map<String, ActorSpec> suite) {
        final Map<String, ActorSpec> merged = new TreeMap<>(Objects.requireNonNull(global, "global"));
        merged.putAll(Objects.requireNonNull(suite, "suite"));
        return merged;
    }

    /**
     * Connects and authenticates every actor against {@code namespace}/{@code database}.
     * Sessions opened before a failure are closed again.
     *
     * @throws ConfigurationException when a required credential cannot be resolved
     * @throws QueryExecutionException when connecting, signin or namespace selection fails
     */
    public static ActorSessions open(
            final DatabaseClientFactory factory,
            final DatabaseSettings settings,
            final String namespace,
            final String database,
            final Map<String, ActorSpec> specs,
            final Map<String, String> environment) {
        Objects.requireNonNull(factory, "factory");
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(specs, "specs");
        Objects.requireNonNull(environment, "environment");
        final Map<String, ActorSession> sessions = new LinkedHashMap<>();
        final ActorSessions opened = new ActorSessions(sessions);
        try {
            sessions.put(ROOT, openDefaultRoot(factory, settings, namespace, database));
            for (final Map.Entry<String, ActorSpec> entry : specs.entrySet()) {
                final ActorSession session = new Builder(
                        entry.getKey(), entry.getValue(), factory, settings, namespace, database, environment)
                        .open();
                final ActorSession replaced = sessions.put(entry.getKey(), session);
                if (replaced != null) {
                    replaced.close();
                }
            }
            return opened;
        } catch (final RuntimeException exception) {
            try {
                opened.close();
            } catch (final RuntimeException closeFailure) {
                exception.addSuppressed(closeFailure);
            }
            throw exception;
        }
    }

    public ActorSession require(final String name) {
        final ActorSession session = sessions.get(name);
        if (session == null) {
            throw new ConfigurationException("actor '" + name + "' not configured");
        }
        return session;
    }

    public ActorSession root() {
        return require(ROOT);
    }

    public List<String> names() {
        return List.copyOf(sessions.keySet());
    }

    @Override
    public void close() {
        final List<ActorSession> open = new ArrayList<>(sessions.values());
        sessions.clear();
        RuntimeException failure = null;
        for (final ActorSession session : open) {
            try {
                session.close();
            } catch (final RuntimeException exception) {
                if (failure == null) {
                    failure = exception;
                } else {
                    failure.addSuppressed(exception);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * First non-blank of the literal, the named environment variable and the default.
     *
     * @throws ConfigurationException when nothing resolves; names the variable when one was
     *     given but unset
     */
    static String resolve(
            final String literal,
            final String environmentName,
            final String defaultValue,
            final Map<String, String> environment,
            final String label) {
        if (literal != null && !literal.isBlank()) {
            return literal;
        }
        if (environmentName != null) {
            final String value = environment.get(environmentName);
            if (value != null && !value.isBlank()) {
                return value;
            }
            if (defaultValue == null || defaultValue.isBlank()) {
                throw new ConfigurationException(
                        "missing " + label + ": environment variable " + environmentName + " is not set");
            }
        }
        if (defaultValue != null && !defaultValue.isBlank()) {
            return defaultValue;
        }
        throw new ConfigurationException("missing " + label);
    }

    private static ActorSession openDefaultRoot(
            final DatabaseClientFactory factory,
            final DatabaseSettings settings,
            final String namespace,
            final String database) {
        final DatabaseClient client = connect(factory, settings, "root actor");
        try {
            client.signin(Credentials.root(settings.username(), settings.password()));
            client.use(namespace, database);
        } catch (final QueryExecutionException exception) {
            client.close();
            throw QueryExecutionException.wrap("root actor setup for ns=" + namespace + " db=" + database, exception);
        }
        return new ActorSession(ROOT, client, Map.of());
    }

    private static DatabaseClient connect(
            final DatabaseClientFactory factory,
            final DatabaseSettings settings,
            final String label) {
        try {
            return factory.connect(settings.host());
        } catch (final QueryExecutionException exception) {
            throw QueryExecutionException.wrap("connecting " + label + " to " + settings.host(), exception);
        }
    }

    private static final class Builder {
        private final String name;
        private final ActorSpec spec;
        private final DatabaseClientFactory factory;
        private final DatabaseSettings settings;
        private final String defaultNamespace;
        private final String defaultDatabase;
        private final Map<String, String> environment;

        private Builder(
                final String name,
                final ActorSpec spec,
                final DatabaseClientFactory factory,
                final DatabaseSettings settings,
                final String defaultNamespace,
                final String defaultDatabase,
                final Map<String, String> environment) {
            this.name = name;
            this.spec = Objects.requireNonNull(spec, "spec");
            this.factory = factory;
            this.settings = settings;
            this.defaultNamespace = defaultNamespace;
            this.defaultDatabase = defaultDatabase;
            this.environment = environment;
        }

        ActorSession open() {
            final String namespace = resolve(
                    spec.namespace(), spec.namespaceEnv(), defaultNamespace, environment, label("namespace"));
            final String database = resolve(
                    spec.database(), spec.databaseEnv(), defaultDatabase, environment, label("database"));
            // credentials resolve before any connection opens
            final Credentials credentials = credentials(namespace, database);
            final String token = spec.kind() == ActorKind.TOKEN
                    ? required(spec.token(), spec.tokenEnv(), "token")
                    : null;

            final DatabaseClient client = connect(factory, settings, "actor '" + name + "'");
            try {
                final String accessToken;
                if (token != null) {
                    try {
                        client.authenticate(token);
                    } catch (final QueryExecutionException exception) {
                        throw QueryExecutionException.wrap("actor '" + name + "' token authentication failed", exception);
                    }
                    accessToken = token;
                } else {
                    try {
                        accessToken = client.signin(credentials);
                    } catch (final QueryExecutionException exception) {
                        throw QueryExecutionException.wrap(
                                "actor '" + name + "' " + spec.kind().value() + " signin failed", exception);
                    }
                }
                try {
                    client.use(namespace, database);
                } catch (final QueryExecutionException exception) {
                    throw QueryExecutionException.wrap(
                            "actor '" + name + "' use failed for " + namespace + "/" + database, exception);
                }
                return new ActorSession(name, client, headers(accessToken));
            } catch (final RuntimeException exception) {
                client.close();
                throw exception;
            }
        }

        private Credentials credentials(final String namespace, final String database) {
            return switch (spec.kind()) {
                case ROOT -> Credentials.root(
                        resolve(spec.username(), spec.usernameEnv(), settings.username(), environment,
                                label("root username")),
                        resolve(spec.password(), spec.passwordEnv(), settings.password(), environment,
                                label("root password")));
                case NAMESPACE -> Credentials.namespace(
                        namespace,
                        required(spec.username(), spec.usernameEnv(), "namespace username"),
                        required(spec.password(), spec.passwordEnv(), "namespace password"));
                case DATABASE -> Credentials.database(
                        namespace,
                        database,
                        required(spec.username(), spec.usernameEnv(), "database username"),
                        required(spec.password(), spec.passwordEnv(), "database password"));
                case RECORD -> Credentials.record(
                        namespace,
                        database,
                        required(spec.access(), spec.accessEnv(), "access method"),
                        spec.params() == null ? Map.of() : spec.params());
                case HEADERS -> Credentials.root(settings.username(), settings.password());
                case TOKEN -> null;
            };
        }

        private Map<String, String> headers(final String accessToken) {
            final Map<String, String> headers = new TreeMap<>(spec.headers());
            if (accessToken != null && !accessToken.isBlank() && !hasAuthorization(headers)) {
                headers.put(AUTHORIZATION_HEADER, "Bearer " + accessToken);
            }
            return headers;
        }

        private String required(final String literal, final String environmentName, final String what) {
            return resolve(literal, environmentName, null, environment, label(what));
        }

        private String label(final String what) {
            return "actor '" + name + "' " + what;
        }

        private static boolean hasAuthorization(final Map<String, String> headers) {
            for (final String key : headers.keySet()) {
                if (AUTHORIZATION_HEADER.equalsIgnoreCase(key)) {
                    return true;
                }
            }
            return false;
        }
    }
}
