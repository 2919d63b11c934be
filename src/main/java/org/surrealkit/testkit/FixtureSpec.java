package org.surrealkit.testkit;

/**
 * Setup statement applied before a suite's cases; exactly one of {@code sql} and {@code file}
 * is set.
 */
public record FixtureSpec(String name, String actor, String sql, String file) {
    public String displayName() {
        return name == null ? "unnamed" : name;
    }

    public String actorOrDefault() {
        return actor == null ? ActorSessions.ROOT : actor;
    }

    public boolean targetsRoot() {
        return ActorSessions.ROOT.equals(actorOrDefault());
    }
}
