package org.surrealkit.testkit;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * HTTP request against the API base URL. {@code bodyPresent} distinguishes a JSON
 * {@code null} body from no body.
 */
public record ApiRequestCase(
        String actor,
        String method,
        String path,
        int expectedStatus,
        Map<String, String> headers,
        boolean bodyPresent,
        Object body,
        Long timeoutMs,
        List<JsonAssertionSpec> bodyAssertions,
        List<HeaderAssertionSpec> headerAssertions) implements CaseDefinition {
    public static final String LABEL = "api_request";

    public ApiRequestCase {
        method = method == null || method.isBlank() ? "GET" : method.trim().toUpperCase(Locale.ROOT);
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(headers));
        bodyAssertions = bodyAssertions == null ? List.of() : List.copyOf(bodyAssertions);
        headerAssertions = headerAssertions == null ? List.of() : List.copyOf(headerAssertions);
    }

    @Override
    public String label() {
        return LABEL;
    }
}
