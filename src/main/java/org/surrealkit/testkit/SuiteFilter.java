package org.surrealkit.testkit;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Narrows loaded suites by suite glob, case glob and required tags. Suites left without cases
 * are dropped.
 */
public final class SuiteFilter {
    private static final String MATCH_ALL = "*";

    private SuiteFilter() {}

    public static List<LoadedSuite> apply(final List<LoadedSuite> suites, final FilterInput filter) {
        Objects.requireNonNull(suites, "suites");
        Objects.requireNonNull(filter, "filter");
        final List<LoadedSuite> retained = new ArrayList<>();
        for (final LoadedSuite suite : suites) {
            if (!matchesSuite(suite, filter.suitePatternOrDefault())) {
                continue;
            }
            final Set<String> suiteTags = new HashSet<>(suite.spec().tags());
            final List<CaseSpec> cases = new ArrayList<>();
            for (final CaseSpec testCase : suite.spec().cases()) {
                if (GlobMatcher.matches(filter.casePatternOrDefault(), testCase.name())
                        && hasAllTags(suiteTags, testCase, filter.tags())) {
                    cases.add(testCase);
                }
            }
            if (!cases.isEmpty()) {
                retained.add(suite.withCases(cases));
            }
        }
        return List.copyOf(retained);
    }

    private static boolean matchesSuite(final LoadedSuite suite, final String pattern) {
        return GlobMatcher.matches(pattern, suite.displayName()) || GlobMatcher.matches(pattern, suite.path());
    }

    private static boolean hasAllTags(final Set<String> suiteTags, final CaseSpec testCase, final List<String> required) {
        for (final String tag : required) {
            if (!suiteTags.contains(tag) && !testCase.tags().contains(tag)) {
                return false;
            }
        }
        return true;
    }

    public record FilterInput(String suitePattern, String casePattern, List<String> tags) {
        public FilterInput {
            tags = tags == null ? List.of() : List.copyOf(tags);
        }

        public static FilterInput all() {
            return new FilterInput(null, null, List.of());
        }

        String suitePatternOrDefault() {
            return suitePattern == null || suitePattern.isEmpty() ? MATCH_ALL : suitePattern;
        }

        String casePatternOrDefault() {
            return casePattern == null || casePattern.isEmpty() ? MATCH_ALL : casePattern;
        }
    }
}
