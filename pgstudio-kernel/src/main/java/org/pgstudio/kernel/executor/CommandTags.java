package org.pgstudio.kernel.executor;

import java.util.Locale;

/**
 * Derives a command tag (the leading keyword) from statement text. The JDBC driver does not expose
 * the server's command tag, so comments are skipped and the first word is used.
 */
final class CommandTags {

    private CommandTags() {
    }

    static String of(String statement) {
        if (statement == null) return "";
        String s = statement;
        int i = 0;
        int n = s.length();
        while (i < n) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c) || c == '(') {
                i++;
            } else if (c == '-' && i + 1 < n && s.charAt(i + 1) == '-') {
                int eol = s.indexOf('\n', i);
                i = eol < 0 ? n : eol + 1;
            } else if (c == '/' && i + 1 < n && s.charAt(i + 1) == '*') {
                int end = s.indexOf("*/", i + 2);
                i = end < 0 ? n : end + 2;
            } else {
                break;
            }
        }
        int start = i;
        while (i < n && Character.isLetter(s.charAt(i))) {
            i++;
        }
        return s.substring(start, i).toUpperCase(Locale.ROOT);
    }
}
