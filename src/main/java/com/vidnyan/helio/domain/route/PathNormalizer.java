package com.vidnyan.helio.domain.route;

import java.util.regex.Pattern;

/**
 * Canonical form of a route path, used to match specification paths against implementation paths.
 * Pure, total and idempotent.
 */
public final class PathNormalizer {

    // <id> or <int:id>
    private static final Pattern ANGLE_PARAM = Pattern.compile("<(?:[^:<>]+:)?(\\w+)>");
    private static final Pattern COLON_PARAM = Pattern.compile(":(\\w+)");

    private PathNormalizer() {
    }

    /**
     * Replace {@code :name} and {@code <name>} parameter tokens with {@code {name}} and drop trailing
     * slashes and whitespace, keeping a lone {@code /}.
     */
    public static String normalize(String path) {
        if (path == null) {
            return "";
        }
        String normalized = path.trim();
        normalized = ANGLE_PARAM.matcher(normalized).replaceAll("{$1}");
        normalized = COLON_PARAM.matcher(normalized).replaceAll("{$1}");

        int end = normalized.length();
        while (end > 1 && isTrailingNoise(normalized.charAt(end - 1))) {
            end--;
        }
        return normalized.substring(0, end);
    }

    // same whitespace rule as String.trim
    private static boolean isTrailingNoise(char c) {
        return c == '/' || c <= ' ';
    }

    /**
     * True if the path declares at least one parameter token in any supported notation.
     */
    public static boolean hasParameter(String path) {
        return path != null && (path.contains(":") || path.contains("{") || ANGLE_PARAM.matcher(path).find());
    }

    public static boolean samePath(String left, String right) {
        return normalize(left).equals(normalize(right));
    }
}
