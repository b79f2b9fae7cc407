package com.hrdb.runner.report;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TableFormatterTest {

    @Test
    @DisplayName("Grid pads cells to the widest value per column")
    void format_grid() {
        String table = TableFormatter.format(List.of("ID", "NAME"),
                List.of(List.of("1", "Ada"), List.of("22", "Grace")));

        String expected = String.join("\n",
                "+----+-------+",
                "| ID | NAME  |",
                "+====+=======+",
                "| 1  | Ada   |",
                "+----+-------+",
                "| 22 | Grace |",
                "+----+-------+");
        assertEquals(expected, table);
    }

    @Test
    @DisplayName("Header-only table is closed with a plain rule")
    void format_noRows() {
        String table = TableFormatter.format(List.of("COUNT"), List.of());

        assertEquals(String.join("\n",
                "+-------+",
                "| COUNT |",
                "+-------+"), table);
    }

    @Test
    @DisplayName("Short rows are padded with empty cells")
    void format_shortRow() {
        String table = TableFormatter.format(List.of("A", "B"), List.of(List.of("1")));

        assertTrue(table.contains("| 1 |   |"));
    }

    @Test
    @DisplayName("abbreviate cuts long text at the limit and appends ...")
    void abbreviate_longText() {
        String longText = "SELECT " + "x".repeat(200);

        assertEquals(103, TableFormatter.abbreviate(longText, 100).length());
        assertTrue(TableFormatter.abbreviate(longText, 100).endsWith("..."));
        assertEquals("SELECT 1", TableFormatter.abbreviate("SELECT 1", 100));
        assertEquals("x".repeat(100), TableFormatter.abbreviate("x".repeat(100), 100));
    }
}
