package org.surrealkit.client;

@FunctionalInterface
public interface DatabaseClientFactory {
    DatabaseClient connect(String address);
}
