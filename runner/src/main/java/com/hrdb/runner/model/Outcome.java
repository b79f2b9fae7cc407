package com.hrdb.runner.model;

import java.util.List;

/**
 * Result of executing a single statement. Exactly one variant is produced
 * per statement.
 */
public sealed interface Outcome permits Outcome.WithRows, Outcome.NoRows, Outcome.Failure {

    /** Maximum number of rows a preview may hold. */
    int PREVIEW_LIMIT = 5;

    /** Number of rows kept once a result is larger than {@link #PREVIEW_LIMIT}. */
    int TRUNCATED_PREVIEW_SIZE = 3;

    boolean success();

    /**
     * The statement produced a result set, possibly empty.
     */
    record WithRows(int rowCount, List<String> columnNames, List<List<String>> preview) implements Outcome {

        public WithRows {
            if (rowCount < 0) {
                throw new IllegalArgumentException("rowCount must be >= 0, got " + rowCount);
            }
            columnNames = List.copyOf(columnNames);
            preview = preview.stream().map(List::copyOf).toList();
            if (preview.size() > PREVIEW_LIMIT) {
                throw new IllegalArgumentException(
                        "Preview holds " + preview.size() + " rows, limit is " + PREVIEW_LIMIT);
            }
            if (preview.size() > rowCount) {
                throw new IllegalArgumentException("Preview is larger than the result");
            }
        }

        @Override
        public boolean success() {
            return true;
        }

        public boolean previewTruncated() {
            return preview.size() < rowCount;
        }
    }

    /**
     * The statement executed but produced no result set (DDL, DML).
     */
    record NoRows() implements Outcome {

        @Override
        public boolean success() {
            return true;
        }
    }

    /**
     * The store rejected the statement.
     */
    record Failure(String errorMessage) implements Outcome {

        public Failure {
            if (errorMessage == null || errorMessage.isBlank()) {
                errorMessage = "Unknown error";
            }
        }

        @Override
        public boolean success() {
            return false;
        }
    }
}
