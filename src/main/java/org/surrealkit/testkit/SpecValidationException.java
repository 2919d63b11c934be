package org.surrealkit.testkit;

import java.util.List;
import java.util.Objects;
import org.surrealkit.config.ConfigurationException;

/**
 * Aggregated test spec document errors, one path-qualified message per issue.
 */
public final class SpecValidationException extends ConfigurationException {
    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public SpecValidationException(final List<String> errors) {
        super(formatMessage(errors));
        this.errors = List.copyOf(Objects.requireNonNull(errors, "errors"));
    }

    public List<String> errors() {
        return errors;
    }

    private static String formatMessage(final List<String> errors) {
        final List<String> normalized = List.copyOf(Objects.requireNonNull(errors, "errors"));
        if (normalized.isEmpty()) {
            return "test spec validation failed";
        }
        final StringBuilder sb = new StringBuilder();
        sb.append("test spec validation failed (")
                .append(normalized.size())
                .append(" issue(s))");
        for (final String error : normalized) {
            sb.append('\n').append("- ").append(error);
        }
        return sb.toString();
    }
}
