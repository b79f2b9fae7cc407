package com.hrdb.runner.report;

import com.hrdb.runner.executor.StatementListener;
import com.hrdb.runner.model.Outcome;
import com.hrdb.runner.model.RunSummary;
import com.hrdb.runner.model.SqlStatement;
import com.hrdb.runner.model.StatementOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Prints the live console report for a batch run. Statement blocks are
 * printed as outcomes arrive; the summary block is printed once the run
 * has finished.
 */
public class ConsoleReporter implements StatementListener {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleReporter.class);

    static final int SQL_PREVIEW_CHARS = 100;
    static final int ERROR_PREVIEW_CHARS = 200;

    private final PrintStream out;
    private final boolean verbose;
    private final ReportFileWriter fileWriter;

    public ConsoleReporter(PrintStream out, boolean verbose) {
        this(out, verbose, new ReportFileWriter());
    }

    ConsoleReporter(PrintStream out, boolean verbose, ReportFileWriter fileWriter) {
        this.out = out;
        this.verbose = verbose;
        this.fileWriter = fileWriter;
    }

    public void printHeader(String scriptName, int statementCount) {
        out.println("Executing all statements from " + scriptName);
        out.println("=".repeat(60));
        out.println("Found " + statementCount + " statements to execute");
        out.println();
    }

    @Override
    public void beforeStatement(SqlStatement statement) {
        out.println("Statement " + statement.position() + ":");
        if (verbose) {
            out.println("   " + TableFormatter.abbreviate(statement.text(), SQL_PREVIEW_CHARS));
        }
    }

    @Override
    public void afterStatement(StatementOutcome result) {
        Outcome outcome = result.outcome();
        if (outcome instanceof Outcome.WithRows rows) {
            printRows(rows);
        } else if (outcome instanceof Outcome.NoRows) {
            out.println("   OK: statement executed (no result set)");
        } else if (outcome instanceof Outcome.Failure failure) {
            out.println("   ERROR: " + TableFormatter.abbreviate(failure.errorMessage(), ERROR_PREVIEW_CHARS));
        }
        out.println();
    }

    private void printRows(Outcome.WithRows rows) {
        if (!verbose) {
            out.println("   OK: " + rows.rowCount() + " rows returned");
            return;
        }
        out.println("   OK: " + rows.rowCount() + " rows");
        if (rows.columnNames().isEmpty()) {
            return;
        }
        String table = TableFormatter.format(rows.columnNames(), rows.preview());
        for (String line : table.split("\n")) {
            out.println("   " + line);
        }
        if (rows.previewTruncated()) {
            out.println("   ... and " + (rows.rowCount() - rows.preview().size()) + " more rows");
        }
    }

    public void printSummary(RunSummary summary) {
        out.println("Execution Summary");
        out.println("=".repeat(40));
        out.println("Successful: " + summary.successCount());
        out.println("Failed: " + summary.failureCount());
        out.println("Total: " + summary.totalCount());
        out.println("Duration: " + summary.durationMs() + "ms");
    }

    /**
     * Saves the summary to {@code path}. A write failure is reported on the
     * console and otherwise ignored.
     *
     * @return true if the file was written
     */
    public boolean saveReport(RunSummary summary, Path path) {
        try {
            fileWriter.write(summary, path);
            out.println();
            out.println("Results saved to: " + path);
            return true;
        } catch (IOException e) {
            logger.warn("Could not write report to {}", path, e);
            out.println();
            out.println("Error saving results: " + describe(e));
            return false;
        }
    }

    private static String describe(IOException e) {
        String message = e.getMessage();
        if (message == null) {
            return e.getClass().getSimpleName();
        }
        return e.getClass().getSimpleName() + ": " + message;
    }
}
