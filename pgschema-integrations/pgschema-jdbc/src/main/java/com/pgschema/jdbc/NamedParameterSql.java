package com.pgschema.jdbc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SQL text whose {@code :name} markers have been replaced by JDBC {@code ?}
 * placeholders, plus the marker names in placeholder order.
 *
 * <p>Markers inside string literals, quoted identifiers and comments are left
 * alone, as are PostgreSQL {@code ::type} casts. A name may appear more than
 * once; each occurrence gets its own placeholder.
 */
final class NamedParameterSql {

    private final String       sql;
    private final List<String> names;

    private NamedParameterSql(String sql, List<String> names) {
        this.sql   = sql;
        this.names = Collections.unmodifiableList(names);
    }

    String       getSql()   { return sql; }
    List<String> getNames() { return names; }

    static NamedParameterSql parse(String text) {
        StringBuilder out = new StringBuilder(text.length());
        List<String> names = new ArrayList<>();
        int n = text.length();
        int i = 0;
        while (i < n) {
            char c = text.charAt(i);
            if (c == '\'' || c == '"') {
                int end = skipQuoted(text, i, c);
                out.append(text, i, end);
                i = end;
            } else if (c == '-' && i + 1 < n && text.charAt(i + 1) == '-') {
                int end = text.indexOf('\n', i);
                end = end < 0 ? n : end;
                out.append(text, i, end);
                i = end;
            } else if (c == '/' && i + 1 < n && text.charAt(i + 1) == '*') {
                int end = text.indexOf("*/", i + 2);
                end = end < 0 ? n : end + 2;
                out.append(text, i, end);
                i = end;
            } else if (c == ':' && i + 1 < n && text.charAt(i + 1) == ':') {
                out.append("::");
                i += 2;
            } else if (c == ':' && i + 1 < n && isNameStart(text.charAt(i + 1))) {
                int end = i + 2;
                while (end < n && isNamePart(text.charAt(end))) end++;
                names.add(text.substring(i + 1, end));
                out.append('?');
                i = end;
            } else {
                out.append(c);
                i++;
            }
        }
        return new NamedParameterSql(out.toString(), names);
    }

    // Doubled quote characters escape themselves inside literals and identifiers.
    private static int skipQuoted(String text, int start, char quote) {
        int i = start + 1;
        while (i < text.length()) {
            if (text.charAt(i) == quote) {
                if (i + 1 < text.length() && text.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return text.length();
    }

    private static boolean isNameStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isNamePart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
