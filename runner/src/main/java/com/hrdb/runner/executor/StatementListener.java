package com.hrdb.runner.executor;

import com.hrdb.runner.model.SqlStatement;
import com.hrdb.runner.model.StatementOutcome;

/**
 * Receives progress callbacks while a batch executes.
 */
public interface StatementListener {

    default void beforeStatement(SqlStatement statement) {
    }

    default void afterStatement(StatementOutcome result) {
    }
}
