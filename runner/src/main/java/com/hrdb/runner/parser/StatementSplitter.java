package com.hrdb.runner.parser;

import com.hrdb.runner.model.SqlStatement;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a SQL script into independently executable statements.
 *
 * <p>The splitter is line-oriented: a statement ends on a line whose trimmed
 * text ends with {@code ;}. Lines starting with {@code --} are dropped, and
 * block comments are recognised only when their delimiters start
 * ({@code /*}) or end ({@code *&#47;}) a trimmed line. Nested block comments
 * are not supported; the first closing delimiter ends the block.
 *
 * <p>A {@code ;} in the middle of a line is never a terminator, so
 * {@code SELECT 1; SELECT 2;} on one line yields a single statement.
 */
public class StatementSplitter {

    static final String LINE_COMMENT = "--";
    static final String BLOCK_COMMENT_START = "/*";
    static final String BLOCK_COMMENT_END = "*/";
    static final String TERMINATOR = ";";
    static final char BYTE_ORDER_MARK = '\uFEFF';

    enum State {
        NORMAL,
        IN_BLOCK_COMMENT
    }

    /**
     * Splits the given script text.
     *
     * @param script full script text, may be empty
     * @return statements in script order, positions starting at 1
     */
    public List<SqlStatement> split(String script) {
        List<SqlStatement> statements = new ArrayList<>();
        if (script == null || script.isEmpty()) {
            return statements;
        }

        State state = State.NORMAL;
        StringBuilder buffer = new StringBuilder();

        for (String rawLine : stripByteOrderMark(script).split("\\R", -1)) {
            String line = rawLine.trim();

            if (state == State.IN_BLOCK_COMMENT) {
                if (line.endsWith(BLOCK_COMMENT_END)) {
                    state = State.NORMAL;
                }
                continue;
            }
            if (line.isEmpty() || line.startsWith(LINE_COMMENT)) {
                continue;
            }
            if (line.startsWith(BLOCK_COMMENT_START)) {
                if (!closesOnSameLine(line)) {
                    state = State.IN_BLOCK_COMMENT;
                }
                continue;
            }

            if (!buffer.isEmpty()) {
                buffer.append(' ');
            }
            buffer.append(line);

            if (line.endsWith(TERMINATOR)) {
                emit(buffer, statements);
            }
        }

        // Last statement does not need a terminator
        emit(buffer, statements);
        return statements;
    }

    private static String stripByteOrderMark(String script) {
        return script.charAt(0) == BYTE_ORDER_MARK ? script.substring(1) : script;
    }

    private static boolean closesOnSameLine(String line) {
        return line.length() >= BLOCK_COMMENT_START.length() + BLOCK_COMMENT_END.length()
                && line.endsWith(BLOCK_COMMENT_END);
    }

    private static void emit(StringBuilder buffer, List<SqlStatement> statements) {
        String text = buffer.toString().trim();
        buffer.setLength(0);
        // A bare terminator is an empty statement
        if (!text.replace(TERMINATOR, "").isBlank()) {
            statements.add(new SqlStatement(statements.size() + 1, text));
        }
    }
}
