package com.hrdb.runner.report;

import java.util.List;

/**
 * Renders rows as a plain-text grid:
 * <pre>
 * +----+-------+
 * | id | name  |
 * +====+=======+
 * | 1  | Alice |
 * +----+-------+
 * </pre>
 */
public final class TableFormatter {

    private TableFormatter() {
    }

    public static String format(List<String> headers, List<List<String>> rows) {
        int columns = headers.size();
        int[] widths = new int[columns];
        for (int i = 0; i < columns; i++) {
            widths[i] = headers.get(i).length();
        }
        for (List<String> row : rows) {
            for (int i = 0; i < columns && i < row.size(); i++) {
                widths[i] = Math.max(widths[i], row.get(i).length());
            }
        }

        StringBuilder sb = new StringBuilder();
        appendRule(sb, widths, '-');
        appendRow(sb, widths, headers);
        appendRule(sb, widths, rows.isEmpty() ? '-' : '=');
        for (List<String> row : rows) {
            appendRow(sb, widths, row);
            appendRule(sb, widths, '-');
        }
        sb.setLength(sb.length() - 1);
        return sb.toString();
    }

    /**
     * Cuts {@code text} to {@code maxLength} characters, appending
     * {@code "..."} when it was cut.
     */
    public static String abbreviate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...";
    }

    private static void appendRule(StringBuilder sb, int[] widths, char fill) {
        sb.append('+');
        for (int width : widths) {
            sb.append(String.valueOf(fill).repeat(width + 2)).append('+');
        }
        sb.append('\n');
    }

    private static void appendRow(StringBuilder sb, int[] widths, List<String> cells) {
        sb.append('|');
        for (int i = 0; i < widths.length; i++) {
            String cell = i < cells.size() ? cells.get(i) : "";
            sb.append(' ').append(cell).append(" ".repeat(widths[i] - cell.length())).append(" |");
        }
        sb.append('\n');
    }
}
