package com.vidnyan.helio.domain.analysis;

import java.util.List;
import java.util.Locale;

/**
 * Keyword signals read from middleware names. Matching is a case-insensitive substring test.
 */
public final class MiddlewareKeywords {

    public static final List<String> AUTH = List.of("auth", "authenticate", "verify", "protect", "jwt");
    public static final List<String> VALIDATION = List.of("validate", "sanitize", "check");

    private MiddlewareKeywords() {
    }

    public static boolean hasAuth(List<String> middleware) {
        return matchesAny(middleware, AUTH);
    }

    public static boolean hasValidation(List<String> middleware) {
        return matchesAny(middleware, VALIDATION);
    }

    private static boolean matchesAny(List<String> middleware, List<String> keywords) {
        if (middleware == null) {
            return false;
        }
        return middleware.stream()
                .map(mw -> mw.toLowerCase(Locale.ROOT))
                .anyMatch(mw -> keywords.stream().anyMatch(mw::contains));
    }
}
