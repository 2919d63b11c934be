package org.surrealkit.client;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * {@link HttpTransport} backed by {@link HttpClient}; multi-valued response headers are joined
 * with {@code ", "}.
 */
public final class JdkHttpTransport implements HttpTransport {
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient client;

    public JdkHttpTransport() {
        this(HttpClient.newBuilder().connectTimeout(DEFAULT_CONNECT_TIMEOUT).build());
    }

    public JdkHttpTransport(final HttpClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public HttpResult send(final HttpCall call) throws IOException {
        Objects.requireNonNull(call, "call");
        final HttpRequest.Builder request = HttpRequest.newBuilder().uri(call.uri()).timeout(call.timeout());
        try {
            call.headers().forEach(request::header);
        } catch (final IllegalArgumentException exception) {
            throw new IOException("invalid request header for " + call.uri() + ": " + exception.getMessage(), exception);
        }
        final HttpRequest.BodyPublisher publisher = call.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(call.body());
        request.method(call.method(), publisher);

        final HttpResponse<String> response;
        try {
            response = client.send(request.build(), BodyHandlers.ofString());
        } catch (final InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted while calling " + call.method() + " " + call.uri(), exception);
        }

        final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (final Map.Entry<String, List<String>> entry : response.headers().map().entrySet()) {
            headers.put(entry.getKey(), String.join(", ", entry.getValue()));
        }
        return new HttpResult(response.statusCode(), headers, response.body());
    }
}
