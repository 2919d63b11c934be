package org.surrealkit.testkit;

/**
 * Kind-specific part of a test case. Implementations form a closed set, one per case kind.
 */
public interface CaseDefinition {
    /**
     * Wire name of the kind, e.g. {@code sql_expect}.
     */
    String label();

    /**
     * Actor the case runs as, or {@code null} for root.
     */
    String actor();

    default String actorOrDefault() {
        return actor() == null ? ActorSessions.ROOT : actor();
    }
}
