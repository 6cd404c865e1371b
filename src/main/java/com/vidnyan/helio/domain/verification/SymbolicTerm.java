package com.vidnyan.helio.domain.verification;

/**
 * A named boolean variable of the constraint model. {@code id} is positive and unique per model.
 */
public record SymbolicTerm(int id, String name) {
}
