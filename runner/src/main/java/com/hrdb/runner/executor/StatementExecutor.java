package com.hrdb.runner.executor;

import com.hrdb.runner.model.Outcome;
import com.hrdb.runner.model.ResultAggregator;
import com.hrdb.runner.model.RunSummary;
import com.hrdb.runner.model.SqlStatement;
import com.hrdb.runner.model.StatementOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs statements one at a time against a single connection. A failing
 * statement is recorded as {@link Outcome.Failure} and never stops the
 * statements after it.
 */
public class StatementExecutor {

    private static final Logger logger = LoggerFactory.getLogger(StatementExecutor.class);

    /**
     * Executes every statement in order and returns the finalized summary.
     *
     * @param statements statements in script order
     * @param connection open store connection, owned by the caller
     * @param listener   progress callbacks, invoked on the calling thread
     */
    public RunSummary executeAll(List<SqlStatement> statements, Connection connection,
                                 StatementListener listener) {
        long runStart = System.currentTimeMillis();
        ResultAggregator aggregator = new ResultAggregator();

        for (SqlStatement statement : statements) {
            listener.beforeStatement(statement);
            Outcome outcome = execute(statement, connection);
            StatementOutcome result = aggregator.record(statement, outcome);
            listener.afterStatement(result);
        }

        RunSummary summary = aggregator.finish(System.currentTimeMillis() - runStart);
        logger.info("Executed {} statements ({} successful, {} failed) in {}ms",
                summary.totalCount(), summary.successCount(), summary.failureCount(),
                summary.durationMs());
        return summary;
    }

    /**
     * Executes a single statement. Store errors are captured in the returned
     * outcome rather than thrown.
     */
    public Outcome execute(SqlStatement statement, Connection connection) {
        long start = System.currentTimeMillis();
        try (Statement stmt = connection.createStatement()) {
            boolean hasResultSet = stmt.execute(statement.text());
            Outcome outcome;
            if (hasResultSet) {
                try (ResultSet rs = stmt.getResultSet()) {
                    outcome = rs != null ? readResult(rs) : new Outcome.NoRows();
                }
            } else {
                outcome = new Outcome.NoRows();
            }
            logger.debug("Statement {} succeeded in {}ms", statement.position(),
                    System.currentTimeMillis() - start);
            return outcome;
        } catch (SQLException e) {
            logger.warn("Statement {} failed: {}", statement.position(), e.getMessage());
            return new Outcome.Failure(e.getMessage());
        } catch (RuntimeException e) {
            logger.warn("Statement {} failed with unexpected error", statement.position(), e);
            return new Outcome.Failure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private Outcome readResult(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();

        List<String> columnNames = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columnNames.add(meta.getColumnLabel(i));
        }

        // Keep at most PREVIEW_LIMIT rows in memory
        List<List<String>> preview = new ArrayList<>(Outcome.PREVIEW_LIMIT);
        int rowCount = 0;
        while (rs.next()) {
            rowCount++;
            if (rowCount <= Outcome.PREVIEW_LIMIT) {
                List<String> row = new ArrayList<>(columnCount);
                for (int i = 1; i <= columnCount; i++) {
                    row.add(CellRenderer.render(rs, i));
                }
                preview.add(row);
            }
        }

        if (rowCount > Outcome.PREVIEW_LIMIT) {
            preview = preview.subList(0, Outcome.TRUNCATED_PREVIEW_SIZE);
        }
        return new Outcome.WithRows(rowCount, columnNames, preview);
    }
}
