package com.hrdb.runner.executor;

import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Turns JDBC column values into printable text for previews.
 */
final class CellRenderer {

    static final String NULL_TEXT = "NULL";
    static final int MAX_CELL_CHARS = 200;

    private CellRenderer() {
    }

    static String render(ResultSet rs, int columnIndex) throws SQLException {
        Object value = rs.getObject(columnIndex);
        if (value == null) {
            return NULL_TEXT;
        }
        if (value instanceof byte[] bytes) {
            return "<" + bytes.length + " bytes>";
        }
        if (value instanceof Blob blob) {
            return "<" + blob.length() + " bytes>";
        }
        if (value instanceof Clob clob) {
            long length = clob.length();
            return truncate(clob.getSubString(1, (int) Math.min(length, MAX_CELL_CHARS + 1L)));
        }
        return truncate(String.valueOf(value));
    }

    private static String truncate(String s) {
        if (s.length() <= MAX_CELL_CHARS) {
            return s;
        }
        return s.substring(0, MAX_CELL_CHARS) + "...";
    }
}
