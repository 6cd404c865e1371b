package com.vidnyan.helio.domain.verification;

/**
 * A policy requirement asserted as a named assumption, so the solver can blame it.
 * Lives for a single verification call.
 */
public record TrackedAssumption(
    Kind kind,
    String subject,
    String service,
    String requirement,
    SymbolicTerm term
) {

    public enum Kind {
        MISSING_AUTH,
        MISSING_ROUTE
    }
}
