package com.hrdb.runner.model;

/**
 * One executable unit extracted from a script. Positions are 1-based and
 * follow script order.
 */
public record SqlStatement(int position, String text) {

    public SqlStatement {
        if (position < 1) {
            throw new IllegalArgumentException("Statement position must be >= 1, got " + position);
        }
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Statement text must not be blank");
        }
        text = text.trim();
    }
}
