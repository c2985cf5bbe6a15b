package io.github.koszti.flinksqlgateway.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits SQL text into statements on {@code ;}, ignoring separators inside single-quoted
 * strings, double-quoted identifiers, {@code --} line comments and block comments.
 */
public final class StatementSplitter {

    private StatementSplitter() {
    }

    /**
     * @return trimmed, non-empty statements without their trailing separator
     */
    public static List<String> split(String sql) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int len = sql.length();
        int i = 0;

        while (i < len) {
            char ch = sql.charAt(i);

            if (ch == '-' && i + 1 < len && sql.charAt(i + 1) == '-') {
                int eol = sql.indexOf('\n', i);
                int end = eol == -1 ? len : eol + 1;
                current.append(sql, i, end);
                i = end;
                continue;
            }

            if (ch == '/' && i + 1 < len && sql.charAt(i + 1) == '*') {
                int close = sql.indexOf("*/", i + 2);
                int end = close == -1 ? len : close + 2;
                current.append(sql, i, end);
                i = end;
                continue;
            }

            if (ch == '\'' || ch == '"') {
                int j = i + 1;
                while (j < len) {
                    if (sql.charAt(j) == ch) {
                        if (j + 1 < len && sql.charAt(j + 1) == ch) {
                            j += 2; // doubled quote
                        } else {
                            j++;
                            break;
                        }
                    } else {
                        j++;
                    }
                }
                current.append(sql, i, j);
                i = j;
                continue;
            }

            if (ch == ';') {
                addIfNotBlank(statements, current);
                current.setLength(0);
                i++;
                continue;
            }

            current.append(ch);
            i++;
        }

        addIfNotBlank(statements, current);
        return statements;
    }

    private static void addIfNotBlank(List<String> statements, StringBuilder current) {
        String trimmed = current.toString().trim();
        if (!trimmed.isEmpty()) {
            statements.add(trimmed);
        }
    }
}
