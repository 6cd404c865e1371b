package com.vidnyan.helio.domain.model;

/**
 * A route declared by the specification. {@code routeName} is the join key used by policies.
 */
public record SpecRoute(
    String service,
    String routeName,
    String method,
    String path
) {

    public String describe() {
        return method + " " + path;
    }
}
