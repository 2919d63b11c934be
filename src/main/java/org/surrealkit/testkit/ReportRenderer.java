package org.surrealkit.testkit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.surrealkit.json.JsonEncoder;

/**
 * Renders run reports as a human summary (failures only) and as JSON.
 */
public final class ReportRenderer {
    private ReportRenderer() {}

    public static String toHumanText(final RunReport report) {
        Objects.requireNonNull(report, "report");
        final StringBuilder sb = new StringBuilder();
        sb.append("Test run summary:\n");
        sb.append("  suites: ").append(report.suitesTotal()).append(" total, ")
                .append(report.suitesFailed()).append(" failed\n");
        sb.append("  cases: ").append(report.casesTotal()).append(" total, ")
                .append(report.casesPassed()).append(" passed, ")
                .append(report.casesFailed()).append(" failed\n");
        sb.append("  duration_ms: ").append(report.durationMs()).append('\n');
        for (final SuiteReport suite : report.suites()) {
            sb.append("suite ").append(suite.suiteName())
                    .append(" [").append(suite.namespace()).append(" / ").append(suite.database()).append("]: ")
                    .append(suite.casesPassed()).append(" passed, ")
                    .append(suite.casesFailed()).append(" failed\n");
            for (final CaseReport testCase : suite.cases()) {
                if (testCase.passed()) {
                    continue;
                }
                sb.append("  FAIL ").append(testCase.name())
                        .append(" (").append(testCase.kind()).append(") ")
                        .append(testCase.message() == null ? "unknown failure" : testCase.message())
                        .append('\n');
                for (final AssertionReport assertion : testCase.assertions()) {
                    if (!assertion.passed()) {
                        sb.append("    - ").append(assertion.name()).append(": ")
                                .append(assertion.message()).append('\n');
                    }
                }
            }
        }
        return sb.toString();
    }

    public static String toJson(final RunReport report) {
        return JsonEncoder.encodePretty(Objects.requireNonNull(report, "report").toMap());
    }

    /**
     * Writes the JSON form followed by a newline, creating parent directories.
     */
    public static void writeJson(final Path file, final RunReport report) throws IOException {
        Objects.requireNonNull(file, "file");
        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try {
            Files.writeString(file, toJson(report) + "\n", StandardCharsets.UTF_8);
        } catch (final IOException exception) {
            throw new IOException("writing report file " + file + ": " + exception.getMessage(), exception);
        }
    }
}
