package org.surrealkit.client;

import java.io.IOException;

@FunctionalInterface
public interface HttpTransport {
    HttpResult send(HttpCall call) throws IOException;
}
