package com.vidnyan.helio.adapter.out.scanner;

import com.vidnyan.helio.domain.model.Framework;

import java.util.Objects;

/**
 * Outcome of framework marker detection for a content-inspected file.
 * {@code framework} is set only for {@link Kind#SINGLE}.
 */
public record FrameworkMatch(Kind kind, Framework framework) {

    public enum Kind {
        /** Exactly one idiom's markers were found. */
        SINGLE,
        /** No markers; every candidate idiom is tried. */
        NONE,
        /** Markers of several idioms; every candidate idiom is tried. */
        AMBIGUOUS
    }

    public FrameworkMatch {
        Objects.requireNonNull(kind, "kind must not be null");
        if ((kind == Kind.SINGLE) != (framework != null)) {
            throw new IllegalArgumentException("framework must be set exactly for a single match");
        }
    }

    public static FrameworkMatch single(Framework framework) {
        return new FrameworkMatch(Kind.SINGLE, Objects.requireNonNull(framework));
    }

    public static FrameworkMatch none() {
        return new FrameworkMatch(Kind.NONE, null);
    }

    public static FrameworkMatch ambiguous() {
        return new FrameworkMatch(Kind.AMBIGUOUS, null);
    }
}
