package org.surrealkit.schema;

/**
 * The target server lacks a feature the requested action needs.
 */
public final class CapabilityException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public CapabilityException(final String message) {
        super(message);
    }
}
