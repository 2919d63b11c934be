package org.surrealkit.client;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import org.surrealkit.json.JsonEncoder;
import org.surrealkit.json.JsonValues;

/**
 * {@link DatabaseClient} over SurrealDB's HTTP endpoints ({@code /signin}, {@code /sql}).
 *
 * <p>Bindings are sent as leading {@code LET} statements whose results are dropped from the
 * returned response. Namespace and database selection travel as request headers.
 */
public final class SurrealHttpClient implements DatabaseClient {
    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    private static final Pattern BINDING_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final HttpTransport transport;
    private final URI baseUri;
    private final Duration timeout;
    private String token;
    private String namespace;
    private String database;

    public SurrealHttpClient(final HttpTransport transport, final String address, final Duration timeout) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.baseUri = toBaseUri(address);
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    /**
     * Factory connecting through {@code transport} with the default request timeout.
     */
    public static DatabaseClientFactory factory(final HttpTransport transport) {
        Objects.requireNonNull(transport, "transport");
        return address -> new SurrealHttpClient(transport, address, DEFAULT_TIMEOUT);
    }

    public URI baseUri() {
        return baseUri;
    }

    @Override
    public synchronized String signin(final Credentials credentials) {
        Objects.requireNonNull(credentials, "credentials");
        final Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", "application/json");
        headers.put("Content-Type", "application/json");
        final HttpResult result = send(new HttpCall(
                "POST",
                baseUri.resolve("signin"),
                headers,
                JsonEncoder.encode(credentials.toSigninBody()),
                timeout), "signin");
        if (!result.successful()) {
            throw new QueryExecutionException(
                    credentials.level().name().toLowerCase(Locale.ROOT)
                            + " signin failed (HTTP " + result.status() + "): " + errorDetail(result.body()));
        }
        final Object parsed = parseBody(result.body(), "signin");
        if (!(parsed instanceof Map<?, ?> body) || !(body.get("token") instanceof String issued)) {
            throw new QueryExecutionException("signin response carried no token");
        }
        this.token = issued;
        return issued;
    }

    @Override
    public synchronized void authenticate(final String bearerToken) {
        final String previous = this.token;
        this.token = Objects.requireNonNull(bearerToken, "bearerToken");
        try {
            execute("RETURN true;").check();
        } catch (final QueryExecutionException exception) {
            this.token = previous;
            throw QueryExecutionException.wrap("token authentication failed", exception);
        }
    }

    @Override
    public synchronized void use(final String namespace, final String database) {
        this.namespace = namespace;
        this.database = database;
    }

    @Override
    public synchronized QueryResponse execute(final String statement, final Map<String, Object> bindings) {
        Objects.requireNonNull(statement, "statement");
        final Map<String, Object> safeBindings = bindings == null ? Map.of() : bindings;
        final HttpResult result = send(new HttpCall(
                "POST",
                baseUri.resolve("sql"),
                sqlHeaders(),
                renderBindings(safeBindings) + statement,
                timeout), "query");
        if (!result.successful()) {
            throw new QueryExecutionException(
                    "query failed (HTTP " + result.status() + "): " + errorDetail(result.body()));
        }
        final Object parsed = parseBody(result.body(), "query");
        if (!(parsed instanceof List<?> items)) {
            throw new QueryExecutionException("query response must be a JSON array");
        }
        final List<StatementResult> results = new ArrayList<>(items.size());
        for (int i = safeBindings.size(); i < items.size(); i++) {
            results.add(toStatementResult(items.get(i)));
        }
        return new QueryResponse(results);
    }

    @Override
    public synchronized void close() {
        token = null;
    }

    static String renderBindings(final Map<String, Object> bindings) {
        final StringBuilder sb = new StringBuilder();
        for (final Map.Entry<String, Object> entry : bindings.entrySet()) {
            if (!BINDING_NAME.matcher(entry.getKey()).matches()) {
                throw new IllegalArgumentException("invalid binding name: " + entry.getKey());
            }
            sb.append("LET $").append(entry.getKey()).append(" = ")
                    .append(JsonEncoder.encode(entry.getValue())).append(";\n");
        }
        return sb.toString();
    }

    private Map<String, String> sqlHeaders() {
        final Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", "application/json");
        headers.put("Content-Type", "text/plain");
        if (token != null) {
            headers.put("Authorization", "Bearer " + token);
        }
        if (namespace != null) {
            headers.put("Surreal-NS", namespace);
        }
        if (database != null) {
            headers.put("Surreal-DB", database);
        }
        return headers;
    }

    private HttpResult send(final HttpCall call, final String operation) {
        try {
            return transport.send(call);
        } catch (final IOException exception) {
            throw new QueryExecutionException(operation + " request to " + call.uri() + " failed: "
                    + exception.getMessage(), exception);
        }
    }

    private static Object parseBody(final String body, final String operation) {
        try {
            return JsonValues.parse(body);
        } catch (final IllegalArgumentException exception) {
            throw new QueryExecutionException(operation + " response is not JSON: " + exception.getMessage(), exception);
        }
    }

    private static StatementResult toStatementResult(final Object item) {
        if (!(item instanceof Map<?, ?> entry)) {
            throw new QueryExecutionException("statement result must be a JSON object");
        }
        if ("OK".equals(entry.get("status"))) {
            return StatementResult.success(entry.get("result"));
        }
        final Object detail = entry.containsKey("result") ? entry.get("result") : entry.get("detail");
        return StatementResult.failure(detail == null ? "statement failed" : JsonValues.toText(detail));
    }

    private static String errorDetail(final String body) {
        if (body == null || body.isBlank()) {
            return "empty response";
        }
        try {
            final Object parsed = JsonValues.parse(body);
            if (parsed instanceof Map<?, ?> map) {
                for (final String key : new String[] {"information", "details", "description"}) {
                    if (map.get(key) instanceof String text && !text.isBlank()) {
                        return text;
                    }
                }
            }
        } catch (final IllegalArgumentException ignored) {
            return body.trim();
        }
        return body.trim();
    }

    private static URI toBaseUri(final String address) {
        String normalized = Objects.requireNonNull(address, "address").trim();
        if (normalized.startsWith("ws://")) {
            normalized = "http://" + normalized.substring("ws://".length());
        } else if (normalized.startsWith("wss://")) {
            normalized = "https://" + normalized.substring("wss://".length());
        }
        if (normalized.endsWith("/rpc")) {
            normalized = normalized.substring(0, normalized.length() - "/rpc".length());
        }
        if (!normalized.endsWith("/")) {
            normalized = normalized + "/";
        }
        try {
            final URI uri = URI.create(normalized);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("database address must be absolute: " + address);
            }
            return uri;
        } catch (final IllegalArgumentException exception) {
            throw new IllegalArgumentException("invalid database address: " + address, exception);
        }
    }
}
