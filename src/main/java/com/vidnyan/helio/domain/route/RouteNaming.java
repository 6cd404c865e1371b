package com.vidnyan.helio.domain.route;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Canonical route and service names.
 */
public final class RouteNaming {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{M}\\p{N}]+");
    private static final String SERVICE_SUFFIX = "Service";
    private static final String DEFAULT_BASE = "Routes";

    private RouteNaming() {
    }

    /**
     * {@code POST /orders/:id} becomes {@code post_orders_id}; an empty path becomes {@code <method>_root}.
     */
    public static String routeName(String method, String path) {
        String clean = NON_ALPHANUMERIC.matcher(path == null ? "" : path).replaceAll("_");
        clean = trimUnderscores(clean);
        return method.toLowerCase(Locale.ROOT) + "_" + (clean.isEmpty() ? "root" : clean);
    }

    /**
     * {@code user-service.js} becomes {@code UserServiceService}; {@code routes.py} becomes {@code RoutesService}.
     */
    public static String serviceBaseName(String fileName) {
        String stem = stem(fileName);
        String base = Arrays.stream(stem.split("-"))
                .filter(word -> !word.isEmpty())
                .map(RouteNaming::capitalize)
                .collect(Collectors.joining());
        return base.isEmpty() ? DEFAULT_BASE : base;
    }

    /**
     * Unique service name for a file given the names already taken: {@code Base + "Service"}, then
     * {@code Base + "Service2"}, {@code Base + "Service3"} and so on.
     */
    public static String uniqueServiceName(String fileName, Set<String> taken) {
        String base = serviceBaseName(fileName);
        String candidate = base + SERVICE_SUFFIX;
        int suffix = 1;
        while (taken.contains(candidate)) {
            suffix++;
            candidate = base + SERVICE_SUFFIX + suffix;
        }
        return candidate;
    }

    private static String stem(String fileName) {
        String name = fileName == null ? "" : fileName;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String capitalize(String word) {
        int first = word.offsetByCodePoints(0, 1);
        return word.substring(0, first).toUpperCase(Locale.ROOT) + word.substring(first).toLowerCase(Locale.ROOT);
    }

    private static String trimUnderscores(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '_') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '_') {
            end--;
        }
        return value.substring(start, end);
    }
}
