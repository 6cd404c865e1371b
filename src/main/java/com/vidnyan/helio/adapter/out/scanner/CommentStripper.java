package com.vidnyan.helio.adapter.out.scanner;

/**
 * Removes {@code //} and {@code /* *\/} comments from C-family source while leaving string,
 * template and rune literals intact. Newlines inside block comments are kept so line structure survives.
 */
final class CommentStripper {

    private CommentStripper() {
    }

    static String strip(String source) {
        StringBuilder out = new StringBuilder(source.length());
        int i = 0;
        int n = source.length();
        while (i < n) {
            char c = source.charAt(i);
            char next = i + 1 < n ? source.charAt(i + 1) : '\0';

            if (c == '"' || c == '\'' || c == '`') {
                int end = skipLiteral(source, i, c);
                out.append(source, i, end);
                i = end;
            } else if (c == '/' && next == '/') {
                while (i < n && source.charAt(i) != '\n') {
                    i++;
                }
            } else if (c == '/' && next == '*') {
                i += 2;
                while (i < n && !(source.charAt(i) == '*' && i + 1 < n && source.charAt(i + 1) == '/')) {
                    if (source.charAt(i) == '\n') {
                        out.append('\n');
                    }
                    i++;
                }
                i = Math.min(n, i + 2);
                out.append(' ');
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    // index just past the closing quote; an unterminated single-line literal ends at the newline
    private static int skipLiteral(String source, int start, char quote) {
        int i = start + 1;
        int n = source.length();
        while (i < n) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i + 1;
            }
            if (c == '\n' && quote != '`') {
                return i;
            }
            i++;
        }
        return n;
    }
}
