package org.surrealkit.schema;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.Objects;

/**
 * One schema source file: project-relative path, text and SHA-256 of its raw bytes.
 */
public record SchemaFile(String path, String sql, String hash) {
    public SchemaFile {
        path = Objects.requireNonNull(path, "path").replace('\\', '/');
        sql = Objects.requireNonNull(sql, "sql");
        hash = Objects.requireNonNull(hash, "hash");
    }

    public static SchemaFile of(final String path, final byte[] content) {
        Objects.requireNonNull(content, "content");
        return new SchemaFile(path, new String(content, StandardCharsets.UTF_8), sha256Hex(content));
    }

    public static SchemaFile of(final String path, final String sql) {
        return of(path, Objects.requireNonNull(sql, "sql").getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256Hex(final byte[] content) {
        final MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (final NoSuchAlgorithmException exception) {
            throw new IllegalStateException("SHA-256 unavailable", exception);
        }
        final byte[] hashed = digest.digest(content);
        final StringBuilder sb = new StringBuilder(hashed.length * 2);
        for (final byte item : hashed) {
            sb.append(String.format(Locale.ROOT, "%02x", item));
        }
        return sb.toString();
    }
}
