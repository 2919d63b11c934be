package org.surrealkit.obs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.bson.Document;
import org.junit.jupiter.api.Test;

class StructuredJsonLinesLoggerTest {
    private static final Clock FIXED = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    @Test
    void emitsCorrelationAndCustomFieldsAsJsonLines() {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        StructuredJsonLinesLogger logger = new StructuredJsonLinesLogger(output, FIXED, true);

        CorrelationContext context = CorrelationContext.builder("run-1", "test")
            .suite("users")
            .path("database/tests/suites/users.yaml")
            .build();
        logger.info("suite finished", context, Map.of("casesFailed", 2));
        logger.log(" warn ", "sync idle", CorrelationContext.of("run-2", "sync"));
        logger.close();

        String[] lines = output.toString(StandardCharsets.UTF_8).trim().split("\\R");
        assertEquals(2, lines.length);

        Document first = Document.parse(lines[0]);
        assertEquals("2026-03-01T10:00:00Z", first.getString("timestamp"));
        assertEquals("INFO", first.getString("level"));
        assertEquals("suite finished", first.getString("message"));
        assertEquals("run-1", first.getString("runId"));
        assertEquals("test", first.getString("operation"));
        assertEquals("users", first.getString("suite"));
        assertEquals("database/tests/suites/users.yaml", first.getString("path"));
        assertEquals(2, ((Number) first.get("casesFailed")).intValue());

        Document second = Document.parse(lines[1]);
        assertEquals("WARN", second.getString("level"));
        assertEquals("sync", second.getString("operation"));
        assertNull(second.get("suite"));
        assertFalse(second.containsKey("path"));
    }

    @Test
    void correlationFieldsWinOverCustomFields() {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        StructuredJsonLinesLogger logger = new StructuredJsonLinesLogger(output, FIXED, true);

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("runId", "spoofed");
        fields.put(" ", "blank");
        fields.put("statements", 3);
        logger.log(null, null, CorrelationContext.of("run-1", "migrate"), fields);
        logger.close();

        Document event = Document.parse(output.toString(StandardCharsets.UTF_8).trim());
        assertEquals("run-1", event.getString("runId"));
        assertEquals("INFO", event.getString("level"));
        assertEquals("", event.getString("message"));
        assertEquals(3, ((Number) event.get("statements")).intValue());
        assertFalse(event.containsKey(" "));
    }

    @Test
    void nestedFieldsStayOnOneLine() {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        StructuredJsonLinesLogger logger = new StructuredJsonLinesLogger(output, FIXED, true);

        logger.info("pruned stale entities", CorrelationContext.of("run-1", "sync"),
            Map.of("statements", List.of("REMOVE TABLE a;", "REMOVE TABLE b;"), "detail", Map.of("count", 2)));
        logger.close();

        String text = output.toString(StandardCharsets.UTF_8);
        String[] lines = text.trim().split("\\R");
        assertEquals(1, lines.length);
        assertEquals(1, text.chars().filter(c -> c == '\n').count());
        Document event = Document.parse(lines[0]);
        assertEquals(List.of("REMOVE TABLE a;", "REMOVE TABLE b;"), event.getList("statements", String.class));
        assertEquals(2, ((Number) event.get("detail", Document.class).get("count")).intValue());
    }

    @Test
    void rejectsEventsAfterClose() {
        StructuredJsonLinesLogger logger = new StructuredJsonLinesLogger(new ByteArrayOutputStream(), FIXED, false);
        logger.close();
        logger.close();

        IllegalStateException error = assertThrows(
            IllegalStateException.class,
            () -> logger.info("late", CorrelationContext.of("run-1", "sync")));
        assertEquals("logger is already closed", error.getMessage());
    }

    @Test
    void correlationContextRejectsBlankRunId() {
        assertThrows(IllegalArgumentException.class, () -> CorrelationContext.of("  ", "sync"));
        assertEquals("a.surql", CorrelationContext.of("run", "sync").withPath(" a.surql ").path().orElseThrow());
    }
}
