package com.hrdb.runner.orchestrator;

import com.hrdb.runner.config.AppConfig;
import com.hrdb.runner.executor.StatementExecutor;
import com.hrdb.runner.model.RunSummary;
import com.hrdb.runner.model.SqlStatement;
import com.hrdb.runner.parser.StatementSplitter;
import com.hrdb.runner.report.ConsoleReporter;
import com.hrdb.runner.store.StoreConnector;
import com.hrdb.runner.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.function.Function;

/**
 * Coordinates one batch run: script -> statements -> execution -> report.
 * The script is read before the store is opened, so a missing script never
 * touches the database. Once execution starts every statement is attempted
 * and the summary is always printed.
 */
public class BatchRunner {

    private static final Logger logger = LoggerFactory.getLogger(BatchRunner.class);

    private final AppConfig config;
    private final PrintStream console;
    private final StatementSplitter splitter;
    private final StatementExecutor executor;
    private final Function<AppConfig, StoreConnector> storeOpener;

    public BatchRunner(AppConfig config, PrintStream console) {
        this(config, console, new StatementSplitter(), new StatementExecutor(), StoreConnector::open);
    }

    // Visible for testing
    BatchRunner(AppConfig config, PrintStream console, StatementSplitter splitter,
                StatementExecutor executor, Function<AppConfig, StoreConnector> storeOpener) {
        this.config = config;
        this.console = console;
        this.splitter = splitter;
        this.executor = executor;
        this.storeOpener = storeOpener;
    }

    /**
     * Runs every statement of the configured script.
     *
     * @param outputFile optional report file, may be null
     * @param verbose    print statement text and result previews
     * @return summary of the run
     * @throws ScriptReadException       if the script cannot be read
     * @throws StoreUnavailableException if the store cannot be reached
     */
    public RunSummary run(Path outputFile, boolean verbose) {
        Path scriptPath = config.getScriptPath();
        logger.info("Starting batch run of {} (verbose={}, output={})",
                scriptPath, verbose, outputFile != null ? outputFile : "none");

        String script = readScript(scriptPath);
        List<SqlStatement> statements = splitter.split(script);
        logger.info("Parsed {} statements from {}", statements.size(), scriptPath);

        ConsoleReporter reporter = new ConsoleReporter(console, verbose);

        try (StoreConnector store = storeOpener.apply(config)) {
            Connection connection = store.getConnection();
            try {
                reporter.printHeader(scriptPath.getFileName().toString(), statements.size());
                RunSummary summary = executor.executeAll(statements, connection, reporter);
                reporter.printSummary(summary);

                if (outputFile != null) {
                    reporter.saveReport(summary, outputFile);
                }

                logSummary(summary);
                return summary;
            } finally {
                close(connection);
            }
        }
    }

    private static void close(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            // The run is already complete at this point
            logger.warn("Error closing store connection", e);
        }
    }

    private String readScript(Path scriptPath) {
        if (!Files.exists(scriptPath)) {
            throw new ScriptReadException("Script file not found: " + scriptPath.toAbsolutePath());
        }
        try {
            return Files.readString(scriptPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ScriptReadException("Cannot read script " + scriptPath.toAbsolutePath()
                    + ": " + e.getMessage(), e);
        }
    }

    private void logSummary(RunSummary summary) {
        logger.info("=== Batch Summary ===");
        logger.info("Total: {} ({} successful, {} failed) in {}ms",
                summary.totalCount(), summary.successCount(), summary.failureCount(),
                summary.durationMs());
        if (summary.hasFailures()) {
            summary.failures().forEach(r -> logger.warn("  FAILED: statement {}: {}",
                    r.statement().position(), r.outcome()));
        }
    }
}
