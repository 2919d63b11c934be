package org.surrealkit.config;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the API base URL and request timeout for a test run.
 *
 * <p>Precedence: explicit option, then the global test config, then environment variables,
 * then built-in defaults.
 */
public final class TestDefaults {
    public static final String BASE_URL_VARIABLE = "SURREALKIT_TEST_BASE_URL";
    public static final String TIMEOUT_VARIABLE = "SURREALKIT_TEST_TIMEOUT_MS";
    public static final long DEFAULT_TIMEOUT_MS = 10_000L;

    private TestDefaults() {}

    public static Optional<String> resolveBaseUrl(
            final String option,
            final String configured,
            final Map<String, String> environment) {
        Objects.requireNonNull(environment, "environment");
        String candidate = firstNonBlank(
                option,
                configured,
                environment.get(BASE_URL_VARIABLE),
                environment.get(DatabaseSettings.HOST_VARIABLE));
        return Optional.ofNullable(candidate).map(TestDefaults::normalizeBaseUrl);
    }

    public static long resolveTimeoutMs(
            final Long option,
            final Long configured,
            final Map<String, String> environment) {
        Objects.requireNonNull(environment, "environment");
        if (option != null) {
            return option;
        }
        if (configured != null) {
            return configured;
        }
        final String raw = environment.get(TIMEOUT_VARIABLE);
        if (raw != null) {
            try {
                return Long.parseLong(raw.trim());
            } catch (final NumberFormatException ignored) {
                return DEFAULT_TIMEOUT_MS;
            }
        }
        return DEFAULT_TIMEOUT_MS;
    }

    /**
     * Rewrites websocket schemes to their HTTP equivalents.
     */
    public static String normalizeBaseUrl(final String raw) {
        final String trimmed = Objects.requireNonNull(raw, "raw").trim();
        if (trimmed.startsWith("ws://")) {
            return "http://" + trimmed.substring("ws://".length());
        }
        if (trimmed.startsWith("wss://")) {
            return "https://" + trimmed.substring("wss://".length());
        }
        return trimmed;
    }

    private static String firstNonBlank(final String... values) {
        for (final String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
