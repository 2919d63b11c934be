package org.surrealkit.testkit;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.surrealkit.config.ConfigurationException;
import org.surrealkit.json.JsonEncoder;
import org.surrealkit.json.JsonValues;

/**
 * Evaluates JSON and header assertions into reports. Checks run in order (exists, equals,
 * contains, regex) and the first failing check decides the message.
 */
public final class AssertionEvaluator {
    private AssertionEvaluator() {}

    /**
     * @param index zero-based position, used for the {@code json_assertion_N} label
     * @throws ConfigurationException when the regex does not compile
     */
    public static AssertionReport evaluateJson(final Object actual, final JsonAssertionSpec assertion, final int index) {
        Objects.requireNonNull(assertion, "assertion");
        final String label = "json_assertion_" + (index + 1);
        final String path = assertion.path();
        final Optional<JsonPath.Found> found = JsonPath.lookup(actual, path);
        final boolean exists = found.isPresent();

        if (assertion.exists() != null && assertion.exists() != exists) {
            return AssertionReport.fail(label, "path '" + path + "' existence mismatch: expected "
                    + assertion.exists() + " got " + exists);
        }
        if (found.isEmpty()) {
            return new AssertionReport(label, Boolean.FALSE.equals(assertion.exists()), "path '" + path + "' not found");
        }
        final Object value = found.get().value();
        if (assertion.equalsPresent() && !JsonValues.deepEquals(assertion.equalTo(), value)) {
            return AssertionReport.fail(label, "path '" + path + "' expected " + JsonEncoder.encode(assertion.equalTo())
                    + ", got " + JsonEncoder.encode(value));
        }
        final String text = JsonValues.toText(value);
        if (assertion.contains() != null && !text.contains(assertion.contains())) {
            return AssertionReport.fail(label, "path '" + path + "' missing substring '" + assertion.contains()
                    + "' in '" + text + "'");
        }
        if (assertion.regex() != null
                && !compile(assertion.regex(), "path '" + path + "'").matcher(text).find()) {
            return AssertionReport.fail(label, "path '" + path + "' regex '" + assertion.regex()
                    + "' did not match '" + text + "'");
        }
        return AssertionReport.pass(label, "path '" + path + "' assertion passed");
    }

    /**
     * Header names are matched case-insensitively.
     *
     * @throws ConfigurationException when the regex does not compile
     */
    public static AssertionReport evaluateHeader(
            final Map<String, String> headers,
            final HeaderAssertionSpec assertion,
            final int index) {
        Objects.requireNonNull(headers, "headers");
        Objects.requireNonNull(assertion, "assertion");
        final String label = "header_assertion_" + (index + 1);
        final String name = assertion.name();
        String value = null;
        for (final Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                value = entry.getValue();
                break;
            }
        }
        final boolean exists = value != null;

        if (assertion.exists() != null && assertion.exists() != exists) {
            return AssertionReport.fail(label, "header '" + name + "' existence mismatch expected "
                    + assertion.exists() + " got " + exists);
        }
        if (value == null) {
            return new AssertionReport(label, Boolean.FALSE.equals(assertion.exists()), "header '" + name + "' not found");
        }
        if (assertion.equalTo() != null && !assertion.equalTo().equals(value)) {
            return AssertionReport.fail(label, "header '" + name + "' expected '" + assertion.equalTo()
                    + "' got '" + value + "'");
        }
        if (assertion.contains() != null && !value.contains(assertion.contains())) {
            return AssertionReport.fail(label, "header '" + name + "' missing substring '" + assertion.contains()
                    + "' in '" + value + "'");
        }
        if (assertion.regex() != null && !compile(assertion.regex(), "header '" + name + "'").matcher(value).find()) {
            return AssertionReport.fail(label, "header '" + name + "' regex '" + assertion.regex()
                    + "' did not match '" + value + "'");
        }
        return AssertionReport.pass(label, "header '" + name + "' assertion passed");
    }

    private static Pattern compile(final String regex, final String subject) {
        try {
            return Pattern.compile(regex);
        } catch (final PatternSyntaxException exception) {
            throw new ConfigurationException(
                    "invalid regex '" + regex + "' for " + subject + ": " + exception.getDescription(), exception);
        }
    }
}
