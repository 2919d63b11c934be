package org.surrealkit.testkit;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.surrealkit.client.HttpCall;
import org.surrealkit.client.HttpResult;
import org.surrealkit.client.HttpTransport;
import org.surrealkit.config.ConfigurationException;
import org.surrealkit.json.JsonEncoder;
import org.surrealkit.json.JsonValues;

/**
 * Sends the request described by an {@code api_request} case and checks the response.
 */
public final class ApiRequestExecutor {
    private final HttpTransport transport;

    public ApiRequestExecutor(final HttpTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    /**
     * @param actorHeaders headers of the acting session; case headers override them by name
     * @throws ConfigurationException for an empty path, an unusable URL or an invalid regex
     * @throws IOException when the request fails or times out
     * @throws IllegalStateException when body assertions are requested but the body is not JSON
     */
    public ApiOutcome execute(
            final String baseUrl,
            final ApiRequestCase spec,
            final Map<String, String> actorHeaders,
            final long defaultTimeoutMs) throws IOException {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(spec, "spec");
        final URI uri = resolve(baseUrl, spec.path());

        final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.putAll(Objects.requireNonNull(actorHeaders, "actorHeaders"));
        String body = null;
        if (spec.bodyPresent()) {
            body = JsonEncoder.encode(spec.body());
            headers.putIfAbsent("content-type", "application/json");
        }
        headers.putAll(spec.headers());
        final long timeoutMs = spec.timeoutMs() == null ? defaultTimeoutMs : spec.timeoutMs();

        final HttpResult response;
        try {
            response = transport.send(new HttpCall(spec.method(), uri, headers, body, Duration.ofMillis(timeoutMs)));
        } catch (final IOException exception) {
            throw new IOException("request to " + uri + " failed: " + exception.getMessage(), exception);
        }

        final List<AssertionReport> assertions = new ArrayList<>();
        assertions.add(new AssertionReport(
                "status",
                response.status() == spec.expectedStatus(),
                "expected status " + spec.expectedStatus() + ", got " + response.status()));
        for (int i = 0; i < spec.headerAssertions().size(); i++) {
            assertions.add(AssertionEvaluator.evaluateHeader(response.headers(), spec.headerAssertions().get(i), i));
        }
        if (!spec.bodyAssertions().isEmpty()) {
            final Object parsed = parseBody(response.body());
            for (int i = 0; i < spec.bodyAssertions().size(); i++) {
                assertions.add(AssertionEvaluator.evaluateJson(parsed, spec.bodyAssertions().get(i), i));
            }
        }
        return new ApiOutcome(response.status(), assertions);
    }

    static URI resolve(final String baseUrl, final String rawPath) {
        final String path = rawPath == null ? "" : rawPath.trim();
        if (path.isEmpty()) {
            throw new ConfigurationException("api_request case path cannot be empty");
        }
        String base = baseUrl.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        final String url = base + (path.startsWith("/") ? "" : "/") + path;
        try {
            return URI.create(url);
        } catch (final IllegalArgumentException exception) {
            throw new ConfigurationException("invalid request URL '" + url + "'", exception);
        }
    }

    private static Object parseBody(final String text) {
        if (text.isBlank()) {
            throw new IllegalStateException("body assertions requested but response body is empty");
        }
        try {
            return JsonValues.parse(text);
        } catch (final IllegalArgumentException exception) {
            throw new IllegalStateException("body assertions requested but response body is not valid JSON", exception);
        }
    }

    public record ApiOutcome(int status, List<AssertionReport> assertions) {
        public ApiOutcome {
            assertions = List.copyOf(assertions);
        }

        public boolean passed() {
            return assertions.stream().allMatch(AssertionReport::passed);
        }
    }
}
