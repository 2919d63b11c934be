package org.surrealkit.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class StatementSplitterTest {
    @Test
    void splitsOnTopLevelSemicolonsAndDropsCommentLines() {
        final String sql = """
                -- people
                DEFINE TABLE person SCHEMAFULL;
                  // indented comment
                DEFINE FIELD name ON person TYPE string; -- trailing stays
                """;

        assertEquals(
                List.of("DEFINE TABLE person SCHEMAFULL", "DEFINE FIELD name ON person TYPE string", "-- trailing stays"),
                StatementSplitter.split(sql));
    }

    @Test
    void keepsSemicolonsInsideQuotes() {
        final List<String> statements = StatementSplitter.split(
                "DEFINE EVENT e ON t WHEN true THEN (CREATE log SET m = 'a;b');"
                        + " DEFINE PARAM $x VALUE \"c;d\"; DEFINE TABLE `we;ird`;");

        assertEquals(3, statements.size());
        assertEquals("DEFINE EVENT e ON t WHEN true THEN (CREATE log SET m = 'a;b')", statements.get(0));
        assertEquals("DEFINE PARAM $x VALUE \"c;d\"", statements.get(1));
        assertEquals("DEFINE TABLE `we;ird`", statements.get(2));
    }

    @Test
    void escapedQuoteDoesNotCloseQuotedRegion() {
        final List<String> statements = StatementSplitter.split("SELECT 'it\\'s;fine' FROM x; SELECT 1;");

        assertEquals(List.of("SELECT 'it\\'s;fine' FROM x", "SELECT 1"), statements);
    }

    @Test
    void emptyAndWhitespaceOnlyInputYieldsNothing() {
        assertEquals(List.of(), StatementSplitter.split(""));
        assertEquals(List.of(), StatementSplitter.split(" ;\n ; "));
        assertEquals(List.of(), StatementSplitter.tokenize("   "));
    }

    @Test
    void tokenizesOnAnyWhitespace() {
        assertEquals(
                List.of("DEFINE", "FIELD", "name", "ON", "person"),
                StatementSplitter.tokenize("  DEFINE\tFIELD \n name   ON person "));
    }
}
