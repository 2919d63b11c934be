package org.surrealkit.client;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Received HTTP response; header names are case-insensitive.
 */
public record HttpResult(int status, Map<String, String> headers, String body) {
    public HttpResult {
        final TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        headers = Collections.unmodifiableMap(copy);
        body = Objects.requireNonNullElse(body, "");
    }

    public boolean successful() {
        return status >= 200 && status < 300;
    }
}
