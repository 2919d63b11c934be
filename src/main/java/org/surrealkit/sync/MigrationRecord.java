package org.surrealkit.sync;

/**
 * One ledger row: content hash, source path and application time.
 */
public record MigrationRecord(String id, String file, String appliedAt) {}
