package com.hrdb.runner.report;

import com.hrdb.runner.model.Outcome;
import com.hrdb.runner.model.RunSummary;
import com.hrdb.runner.model.StatementOutcome;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a finished run to a plain-text report, one block per statement.
 * The format is meant for people, not for parsing.
 */
public class ReportFileWriter {

    static final String TITLE = "Query Execution Results";
    static final String TITLE_RULE = "=".repeat(30);
    static final String BLOCK_SEPARATOR = "-".repeat(40);
    static final int SQL_PREVIEW_CHARS = 100;

    /**
     * Writes the report, replacing any existing file. Parent directories are
     * not created.
     *
     * @throws IOException when the target cannot be written
     */
    public void write(RunSummary summary, Path path) throws IOException {
        try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            out.write(render(summary));
        }
    }

    String render(RunSummary summary) {
        StringBuilder sb = new StringBuilder();
        sb.append(TITLE).append('\n');
        sb.append(TITLE_RULE).append("\n\n");

        for (StatementOutcome result : summary.results()) {
            sb.append("Statement ").append(result.statement().position()).append(":\n");
            String sql = TableFormatter.abbreviate(result.statement().text(), SQL_PREVIEW_CHARS);
            sb.append("SQL: ").append(sql).append('\n');
            sb.append("Status: ").append(result.success() ? "SUCCESS" : "FAILED").append('\n');

            Outcome outcome = result.outcome();
            if (outcome instanceof Outcome.WithRows rows) {
                sb.append("Results: ").append(rows.rowCount()).append(" rows\n");
                if (!rows.columnNames().isEmpty()) {
                    sb.append("Columns: ").append(String.join(", ", rows.columnNames())).append('\n');
                }
            } else if (outcome instanceof Outcome.NoRows) {
                sb.append("Results: no result set\n");
            } else if (outcome instanceof Outcome.Failure failure) {
                sb.append("Error: ").append(failure.errorMessage()).append('\n');
            }
            sb.append(BLOCK_SEPARATOR).append("\n\n");
        }
        return sb.toString();
    }
}
