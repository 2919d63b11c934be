package org.surrealkit.client;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One outgoing HTTP request; {@code body} is {@code null} when no body is sent.
 */
public record HttpCall(String method, URI uri, Map<String, String> headers, String body, Duration timeout) {
    public HttpCall {
        method = Objects.requireNonNull(method, "method").trim().toUpperCase(Locale.ROOT);
        Objects.requireNonNull(uri, "uri");
        headers = headers == null ? Map.of() : Map.copyOf(new LinkedHashMap<>(headers));
        Objects.requireNonNull(timeout, "timeout");
    }
}
