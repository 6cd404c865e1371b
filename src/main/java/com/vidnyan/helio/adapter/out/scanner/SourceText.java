package com.vidnyan.helio.adapter.out.scanner;

import java.util.ArrayList;
import java.util.List;

/**
 * Bracket and literal aware helpers over C-family call text.
 */
final class SourceText {

    private SourceText() {
    }

    /**
     * Literal TCP port, or null when the digits cannot be one.
     */
    static Integer port(String digits) {
        if (digits.length() > 5) {
            return null;
        }
        int port = Integer.parseInt(digits);
        return port <= 65535 ? port : null;
    }

    /**
     * Index of the parenthesis closing the one at {@code openIndex}, or -1.
     */
    static int matchingParen(String code, int openIndex) {
        if (openIndex < 0 || openIndex >= code.length() || code.charAt(openIndex) != '(') {
            return -1;
        }
        int depth = 0;
        int i = openIndex;
        while (i < code.length()) {
            char c = code.charAt(i);
            if (c == '"' || c == '\'' || c == '`') {
                i = skipLiteral(code, i);
                continue;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
            i++;
        }
        return -1;
    }

    /**
     * Split on commas outside brackets and literals. Parts are trimmed; empty parts dropped.
     */
    static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'' || c == '`') {
                i = skipLiteral(text, i);
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == ',' && depth == 0) {
                addPart(parts, text.substring(start, i));
                start = i + 1;
            }
            i++;
        }
        addPart(parts, text.substring(start));
        return parts;
    }

    private static void addPart(List<String> parts, String part) {
        String trimmed = part.trim();
        if (!trimmed.isEmpty()) {
            parts.add(trimmed);
        }
    }

    private static int skipLiteral(String text, int start) {
        char quote = text.charAt(start);
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i + 1;
            }
            i++;
        }
        return text.length();
    }
}
