package com.hrdb.runner.report;

import com.hrdb.runner.model.Outcome;
import com.hrdb.runner.model.ResultAggregator;
import com.hrdb.runner.model.RunSummary;
import com.hrdb.runner.model.SqlStatement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the persisted report format written by {@link ReportFileWriter}.
 */
class ReportFileWriterTest {

    @TempDir
    Path tempDir;

    private final ReportFileWriter writer = new ReportFileWriter();

    private RunSummary summary;

    @BeforeEach
    void setUp() {
        ResultAggregator aggregator = new ResultAggregator();
        aggregator.record(new SqlStatement(1, "SELECT id, name FROM employees;"),
                new Outcome.WithRows(7, List.of("ID", "NAME"),
                        List.of(List.of("1", "a"), List.of("2", "b"), List.of("3", "c"))));
        aggregator.record(new SqlStatement(2, "DELETE FROM employees WHERE id = 9;"),
                new Outcome.NoRows());
        aggregator.record(new SqlStatement(3, "SELECT * FROM nowhere;"),
                new Outcome.Failure("Table \"NOWHERE\" not found"));
        summary = aggregator.finish(15);
    }

    @Test
    @DisplayName("Report contains one block per statement in order")
    void write_blocksPerStatement() throws IOException {
        Path out = tempDir.resolve("results.txt");

        writer.write(summary, out);

        String expected = String.join("\n",
                "Query Execution Results",
                "==============================",
                "",
                "Statement 1:",
                "SQL: SELECT id, name FROM employees;",
                "Status: SUCCESS",
                "Results: 7 rows",
                "Columns: ID, NAME",
                "----------------------------------------",
                "",
                "Statement 2:",
                "SQL: DELETE FROM employees WHERE id = 9;",
                "Status: SUCCESS",
                "Results: no result set",
                "----------------------------------------",
                "",
                "Statement 3:",
                "SQL: SELECT * FROM nowhere;",
                "Status: FAILED",
                "Error: Table \"NOWHERE\" not found",
                "----------------------------------------",
                "",
                "");
        assertEquals(expected, Files.readString(out, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Long statement text is truncated to 100 characters")
    void write_truncatesSql() throws IOException {
        ResultAggregator aggregator = new ResultAggregator();
        String sql = "SELECT " + "a, ".repeat(60) + "b FROM t;";
        aggregator.record(new SqlStatement(1, sql), new Outcome.NoRows());
        Path out = tempDir.resolve("long.txt");

        writer.write(aggregator.finish(0), out);

        String sqlLine = Files.readAllLines(out).stream()
                .filter(l -> l.startsWith("SQL: "))
                .findFirst().orElseThrow();
        assertEquals("SQL: " + sql.substring(0, 100) + "...", sqlLine);
    }

    @Test
    @DisplayName("Existing report is replaced")
    void write_overwrites() throws IOException {
        Path out = tempDir.resolve("results.txt");
        Files.writeString(out, "stale content that is longer than nothing\n".repeat(100));

        writer.write(new ResultAggregator().finish(0), out);

        assertEquals("Query Execution Results\n==============================\n\n",
                Files.readString(out));
    }

    @Test
    @DisplayName("Missing parent directory raises IOException")
    void write_missingDirectory_throws() {
        Path out = tempDir.resolve("no-such-dir").resolve("results.txt");

        assertThrows(IOException.class, () -> writer.write(summary, out));
        assertFalse(Files.exists(out.getParent()));
    }
}
