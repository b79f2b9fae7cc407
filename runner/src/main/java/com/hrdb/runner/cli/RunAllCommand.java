package com.hrdb.runner.cli;

import com.hrdb.runner.config.AppConfig;
import com.hrdb.runner.orchestrator.BatchRunner;
import com.hrdb.runner.orchestrator.ScriptReadException;
import com.hrdb.runner.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Main entry point for the HRDB batch runner. Executes every statement of
 * the configured SQL script and prints a per-statement report.
 *
 * <p>Usage:
 * <pre>
 *   java -jar hrdb-runner.jar                      # run queries.sql against hr_database.db
 *   java -jar hrdb-runner.jar -v                   # include statement text and row previews
 *   java -jar hrdb-runner.jar -o results.txt       # also save a report file
 * </pre>
 *
 * <p>The script and database locations come from {@link AppConfig}.
 */
@Command(
        name = "run-all",
        version = "1.0.0",
        description = "Execute all statements from the configured SQL script",
        mixinStandardHelpOptions = true
)
public class RunAllCommand implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(RunAllCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_UNAVAILABLE = 1;
    static final int EXIT_CONFIG = 3;

    @Option(
            names = {"-o", "--output-file"},
            description = "Save results to file"
    )
    Path outputFile;

    @Option(
            names = {"-v", "--verbose"},
            description = "Show detailed output"
    )
    boolean verbose;

    private final Supplier<AppConfig> configSupplier;
    private final PrintStream console;

    public RunAllCommand() {
        this(AppConfig::new, System.out);
    }

    // Visible for testing
    RunAllCommand(Supplier<AppConfig> configSupplier, PrintStream console) {
        this.configSupplier = configSupplier;
        this.console = console;
    }

    @Override
    public Integer call() {
        AppConfig config;
        try {
            config = configSupplier.get();
        } catch (IllegalStateException e) {
            logger.error("Configuration error", e);
            console.println("Configuration error: " + e.getMessage());
            return EXIT_CONFIG;
        }

        try {
            new BatchRunner(config, console).run(outputFile, verbose);
            // Individual statement failures do not change the exit status
            return EXIT_OK;
        } catch (ScriptReadException e) {
            logger.error("Aborting run: {}", e.getMessage(), e);
            console.println("Error reading script: " + e.getMessage());
            return EXIT_UNAVAILABLE;
        } catch (StoreUnavailableException e) {
            logger.error("Aborting run: {}", e.getMessage(), e);
            console.println("Database not available: " + e.getMessage());
            return EXIT_UNAVAILABLE;
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new RunAllCommand()).execute(args);
        System.exit(exitCode);
    }
}
