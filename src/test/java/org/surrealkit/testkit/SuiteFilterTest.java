package org.surrealkit.testkit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SuiteFilterTest {
    private static final LoadedSuite USERS = suite("database/tests/suites/users.yaml", "users", List.of("smoke"),
            testCase("select_own", List.of()),
            testCase("delete_other", List.of("security")));
    private static final LoadedSuite ORDERS = suite("database/tests/suites/orders.yaml", null, List.of(),
            testCase("create_order", List.of("security")),
            testCase("list_orders", List.of()));

    @Test
    void allFilterKeepsEverything() {
        assertEquals(List.of(USERS, ORDERS), SuiteFilter.apply(List.of(USERS, ORDERS), SuiteFilter.FilterInput.all()));
    }

    @Test
    void suitePatternMatchesDisplayNameOrPath() {
        final List<LoadedSuite> byName = SuiteFilter.apply(
                List.of(USERS, ORDERS), new SuiteFilter.FilterInput("us*", null, List.of()));
        final List<LoadedSuite> byPath = SuiteFilter.apply(
                List.of(USERS, ORDERS), new SuiteFilter.FilterInput("*/orders.yaml", null, List.of()));

        assertEquals(List.of("users"), byName.stream().map(LoadedSuite::displayName).toList());
        assertEquals(List.of("database/tests/suites/orders.yaml"), byPath.stream().map(LoadedSuite::path).toList());
    }

    @Test
    void tagsAreRequiredFromSuiteOrCase() {
        final List<LoadedSuite> retained = SuiteFilter.apply(
                List.of(USERS, ORDERS), new SuiteFilter.FilterInput(null, null, List.of("security")));

        assertEquals(List.of("delete_other"), caseNames(retained.get(0)));
        assertEquals(List.of("create_order"), caseNames(retained.get(1)));

        final List<LoadedSuite> both = SuiteFilter.apply(
                List.of(USERS, ORDERS), new SuiteFilter.FilterInput(null, null, List.of("smoke", "security")));
        assertEquals(1, both.size());
        assertEquals(List.of("delete_other"), caseNames(both.get(0)));
    }

    @Test
    void suitesWithoutRemainingCasesAreDropped() {
        final List<LoadedSuite> retained = SuiteFilter.apply(
                List.of(USERS, ORDERS), new SuiteFilter.FilterInput(null, "*order*", List.of()));

        assertEquals(1, retained.size());
        assertEquals(List.of("create_order", "list_orders"), caseNames(retained.get(0)));
        assertTrue(SuiteFilter.apply(
                List.of(USERS, ORDERS), new SuiteFilter.FilterInput("nothing", null, List.of())).isEmpty());
    }

    private static List<String> caseNames(final LoadedSuite suite) {
        return suite.spec().cases().stream().map(CaseSpec::name).toList();
    }

    private static LoadedSuite suite(final String path, final String name, final List<String> tags, final CaseSpec... cases) {
        return new LoadedSuite(path, Path.of("database/tests/suites"),
                new SuiteSpec(name, tags, Map.of(), List.of(), List.of(cases)));
    }

    private static CaseSpec testCase(final String name, final List<String> tags) {
        return new CaseSpec(name, tags, new SqlExpectCase(null, "RETURN 1;", true, null, null, List.of()));
    }
}
