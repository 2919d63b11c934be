package org.surrealkit.config;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Connection settings for the target database, resolved from environment variables.
 */
public record DatabaseSettings(
        String host,
        String namespace,
        String database,
        String username,
        String password) {
    public static final String HOST_VARIABLE = "PUBLIC_DATABASE_HOST";
    public static final String NAMESPACE_VARIABLE = "PUBLIC_DATABASE_NAMESPACE";
    public static final String DATABASE_VARIABLE = "PUBLIC_DATABASE_NAME";
    public static final String USER_VARIABLE = "DATABASE_USER";
    public static final String PASSWORD_VARIABLE = "DATABASE_PASSWORD";
    public static final String SHARED_DB_VARIABLE = "SURREALKIT_SHARED_DB";
    public static final String OWNER_VARIABLE = "SURREALKIT_OWNER";

    static final String DEFAULT_HOST = "http://localhost:8000";
    static final String DEFAULT_NAMESPACE = "db";
    static final String DEFAULT_DATABASE = "test";
    static final String DEFAULT_USER = "root";
    static final String DEFAULT_PASSWORD = "root";

    public DatabaseSettings {
        host = requireText(host, "host");
        namespace = requireText(namespace, "namespace");
        database = requireText(database, "database");
        username = requireText(username, "username");
        password = Objects.requireNonNull(password, "password");
    }

    public static DatabaseSettings fromEnvironment(final Map<String, String> environment) {
        Objects.requireNonNull(environment, "environment");
        return new DatabaseSettings(
                valueOrDefault(environment, HOST_VARIABLE, DEFAULT_HOST),
                valueOrDefault(environment, NAMESPACE_VARIABLE, DEFAULT_NAMESPACE),
                valueOrDefault(environment, DATABASE_VARIABLE, DEFAULT_DATABASE),
                valueOrDefault(environment, USER_VARIABLE, DEFAULT_USER),
                valueOrDefault(environment, PASSWORD_VARIABLE, DEFAULT_PASSWORD));
    }

    /**
     * Parses the loose boolean spellings accepted in environment variables.
     */
    public static Optional<Boolean> parseFlag(final String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "1", "true", "yes", "y", "on" -> Optional.of(Boolean.TRUE);
            case "0", "false", "no", "n", "off" -> Optional.of(Boolean.FALSE);
            default -> Optional.empty();
        };
    }

    private static String valueOrDefault(
            final Map<String, String> environment,
            final String name,
            final String defaultValue) {
        final String value = environment.get(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return value.trim();
    }

    private static String requireText(final String value, final String fieldName) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(fieldName + " must not be blank");
        }
        return value.trim();
    }
}
