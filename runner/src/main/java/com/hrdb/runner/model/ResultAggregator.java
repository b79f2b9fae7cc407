package com.hrdb.runner.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects statement outcomes in execution order and produces the final
 * {@link RunSummary}. Not thread-safe; one aggregator serves one run.
 */
public class ResultAggregator {

    private final List<StatementOutcome> results = new ArrayList<>();
    private int successCount;
    private int failureCount;
    private int lastPosition;
    private boolean finished;

    public StatementOutcome record(SqlStatement statement, Outcome outcome) {
        if (finished) {
            throw new IllegalStateException("Run summary already finalized");
        }
        if (statement.position() <= lastPosition) {
            throw new IllegalArgumentException("Statement " + statement.position()
                    + " recorded after statement " + lastPosition);
        }
        StatementOutcome entry = new StatementOutcome(statement, outcome);
        results.add(entry);
        lastPosition = statement.position();
        if (outcome.success()) {
            successCount++;
        } else {
            failureCount++;
        }
        return entry;
    }

    public RunSummary finish(long durationMs) {
        if (finished) {
            throw new IllegalStateException("Run summary already finalized");
        }
        finished = true;
        return new RunSummary(results, successCount, failureCount, durationMs);
    }
}
