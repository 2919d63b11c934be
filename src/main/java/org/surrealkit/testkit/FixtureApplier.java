package org.surrealkit.testkit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import org.surrealkit.client.QueryExecutionException;
import org.surrealkit.config.ConfigurationException;

/**
 * Applies global then suite fixtures through the sessions of their target actors. Relative
 * fixture files resolve against {@code database/tests} for global fixtures and against the
 * suite's directory for suite fixtures.
 */
final class FixtureApplier {
    private final Path globalBase;

    FixtureApplier(final Path globalBase) {
        this.globalBase = Objects.requireNonNull(globalBase, "globalBase");
    }

    void applyRootTargeted(
            final List<FixtureSpec> global,
            final LoadedSuite suite,
            final ActorSessions sessions) throws IOException {
        applyMatching(global, suite, sessions, FixtureSpec::targetsRoot);
    }

    void applyActorTargeted(
            final List<FixtureSpec> global,
            final LoadedSuite suite,
            final ActorSessions sessions) throws IOException {
        applyMatching(global, suite, sessions, fixture -> !fixture.targetsRoot());
    }

    private void applyMatching(
            final List<FixtureSpec> global,
            final LoadedSuite suite,
            final ActorSessions sessions,
            final Predicate<FixtureSpec> selector) throws IOException {
        for (final FixtureSpec fixture : global) {
            if (selector.test(fixture)) {
                apply(fixture, sessions, globalBase);
            }
        }
        for (final FixtureSpec fixture : suite.spec().fixtures()) {
            if (selector.test(fixture)) {
                apply(fixture, sessions, suite.directory());
            }
        }
    }

    void apply(final FixtureSpec fixture, final ActorSessions sessions, final Path baseDir) throws IOException {
        final ActorSession actor = sessions.require(fixture.actorOrDefault());
        final String sql = sqlFor(fixture, baseDir);
        try {
            actor.client().executeChecked(sql);
        } catch (final QueryExecutionException exception) {
            throw QueryExecutionException.wrap("fixture '" + fixture.displayName() + "' failed", exception);
        }
    }

    static String sqlFor(final FixtureSpec fixture, final Path baseDir) throws IOException {
        if (fixture.sql() != null && fixture.file() != null) {
            throw new ConfigurationException("fixture '" + fixture.displayName() + "' cannot define both sql and file");
        }
        if (fixture.sql() != null) {
            return fixture.sql();
        }
        if (fixture.file() == null) {
            throw new ConfigurationException("fixture '" + fixture.displayName() + "' requires sql or file");
        }
        final Path candidate = Path.of(fixture.file());
        final Path path = candidate.isAbsolute() ? candidate : baseDir.resolve(candidate);
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (final IOException exception) {
            throw new IOException("reading fixture file " + path + ": " + exception.getMessage(), exception);
        }
    }
}
