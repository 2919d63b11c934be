package org.surrealkit.config;

/**
 * Invalid or missing configuration: credentials, test document fields, references, patterns.
 *
 * <p>Never retried; fatal to the operation that discovered it.
 */
public class ConfigurationException extends IllegalArgumentException {
    public ConfigurationException(final String message) {
        super(message);
    }

    public ConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
