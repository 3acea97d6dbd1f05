package org.pgstudio.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a SQL script into individual statements.
 *
 * <p>Single left-to-right scan over an explicit {@link State}. A {@code ;} only terminates a
 * statement in {@link State#NORMAL}, so semicolons inside string literals, dollar-quoted bodies
 * and comments are kept as text.
 *
 * <p>Rules:
 * <ul>
 *   <li>Block comments are not nested: the first closing marker ends the comment.</li>
 *   <li>{@code --} comments run to the end of the line (newline included).</li>
 *   <li>{@code $tag$ ... $tag$} only closes on the exact same tag; other tags inside are text.</li>
 *   <li>{@code ''} inside a single-quoted literal is an escaped quote.</li>
 *   <li>Trailing text is never dropped: an unterminated literal or comment at end of input is
 *       emitted as the last statement.</li>
 * </ul>
 *
 * <p>Never throws.
 */
public final class StatementSplitter {

    /** Scanner states. The active dollar tag is tracked next to {@link #IN_DOLLAR_QUOTE}. */
    public enum State {
        NORMAL,
        IN_SINGLE_QUOTE,
        IN_DOLLAR_QUOTE,
        IN_BLOCK_COMMENT,
        IN_LINE_COMMENT
    }

    private StatementSplitter() {
    }

    public static List<String> split(String script) {
        List<String> statements = new ArrayList<>();
        if (script == null || script.isBlank()) return statements;

        Scanner s = new Scanner(script);
        s.run(statements);
        s.emit(statements);
        return statements;
    }

    /**
     * Returns the state the scanner is left in after consuming the whole script, e.g. to tell
     * whether a script ends inside an unterminated literal or comment.
     */
    public static State finalState(String script) {
        if (script == null) return State.NORMAL;
        Scanner s = new Scanner(script);
        s.run(new ArrayList<>());
        return s.state;
    }

    private static final class Scanner {
        private final String sql;
        private final StringBuilder current = new StringBuilder();
        private State state = State.NORMAL;
        private String dollarTag = "";
        private int pos;

        Scanner(String sql) {
            this.sql = sql;
        }

        void run(List<String> out) {
            while (pos < sql.length()) {
                switch (state) {
                    case NORMAL -> normal(out);
                    case IN_SINGLE_QUOTE -> singleQuote();
                    case IN_DOLLAR_QUOTE -> dollarQuote();
                    case IN_BLOCK_COMMENT -> blockComment();
                    case IN_LINE_COMMENT -> lineComment();
                }
            }
        }

        void normal(List<String> out) {
            char c = sql.charAt(pos);
            char n = peek(1);

            if (c == '/' && n == '*') {
                take(2);
                state = State.IN_BLOCK_COMMENT;
                return;
            }
            if (c == '-' && n == '-') {
                take(2);
                state = State.IN_LINE_COMMENT;
                return;
            }
            if (c == '$') {
                String tag = dollarTagAt(pos);
                if (tag != null) {
                    take(tag.length());
                    dollarTag = tag;
                    state = State.IN_DOLLAR_QUOTE;
                    return;
                }
            }
            if (c == '\'') {
                take(1);
                state = State.IN_SINGLE_QUOTE;
                return;
            }
            if (c == ';') {
                take(1);
                emit(out);
                return;
            }
            take(1);
        }

        void singleQuote() {
            char c = sql.charAt(pos);
            if (c == '\'') {
                if (peek(1) == '\'') {
                    // escaped quote
                    take(2);
                    return;
                }
                take(1);
                state = State.NORMAL;
                return;
            }
            take(1);
        }

        void dollarQuote() {
            if (sql.charAt(pos) == '$') {
                String tag = dollarTagAt(pos);
                if (dollarTag.equals(tag)) {
                    take(tag.length());
                    dollarTag = "";
                    state = State.NORMAL;
                    return;
                }
            }
            take(1);
        }

        void blockComment() {
            if (sql.charAt(pos) == '*' && peek(1) == '/') {
                take(2);
                state = State.NORMAL;
                return;
            }
            take(1);
        }

        void lineComment() {
            char c = sql.charAt(pos);
            take(1);
            if (c == '\n') {
                state = State.NORMAL;
            }
        }

        void emit(List<String> out) {
            String trimmed = current.toString().trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
            current.setLength(0);
        }

        private char peek(int offset) {
            int i = pos + offset;
            return i < sql.length() ? sql.charAt(i) : '\0';
        }

        private void take(int count) {
            int end = Math.min(sql.length(), pos + count);
            current.append(sql, pos, end);
            pos = end;
        }

        /** Matches {@code $[A-Za-z0-9_]*$} at {@code start}, or returns null. */
        private String dollarTagAt(int start) {
            int i = start + 1;
            while (i < sql.length() && isTagChar(sql.charAt(i))) {
                i++;
            }
            if (i < sql.length() && sql.charAt(i) == '$') {
                return sql.substring(start, i + 1);
            }
            return null;
        }

        private static boolean isTagChar(char c) {
            return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
        }
    }
}
