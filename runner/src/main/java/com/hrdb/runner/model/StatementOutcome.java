package com.hrdb.runner.model;

import java.util.Objects;

/**
 * A statement paired with the outcome of running it.
 */
public record StatementOutcome(SqlStatement statement, Outcome outcome) {

    public StatementOutcome {
        Objects.requireNonNull(statement, "statement");
        Objects.requireNonNull(outcome, "outcome");
    }

    public boolean success() {
        return outcome.success();
    }
}
