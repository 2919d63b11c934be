package org.surrealkit.testkit;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class GlobMatcherTest {
    @Test
    void starMatchesAnyRunIncludingEmpty() {
        assertTrue(GlobMatcher.matches("*", ""));
        assertTrue(GlobMatcher.matches("*", "anything at all"));
        assertTrue(GlobMatcher.matches("user_*", "user_"));
        assertTrue(GlobMatcher.matches("*_can_*", "admin_can_delete"));
        assertFalse(GlobMatcher.matches("user_*", "admin_user"));
    }

    @Test
    void questionMarkMatchesExactlyOneCharacter() {
        assertTrue(GlobMatcher.matches("a?c", "abc"));
        assertFalse(GlobMatcher.matches("a?c", "abd"));
        assertFalse(GlobMatcher.matches("a?c", "ac"));
        assertFalse(GlobMatcher.matches("a?c", "abbc"));
    }

    @Test
    void literalPatternRequiresWholeText() {
        assertTrue(GlobMatcher.matches("suite.yaml", "suite.yaml"));
        assertFalse(GlobMatcher.matches("suite", "suite.yaml"));
        assertFalse(GlobMatcher.matches("", "x"));
        assertTrue(GlobMatcher.matches("", ""));
    }
}
