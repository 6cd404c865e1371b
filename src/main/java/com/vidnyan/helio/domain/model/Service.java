package com.vidnyan.helio.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * A service derived from one scanned source file.
 * Never merged across files; name collisions are resolved by suffixing.
 */
public record Service(
    String name,
    Integer port,
    String sourcePath,
    Framework framework,
    List<Route> routes
) {

    public Service {
        Objects.requireNonNull(name, "name must not be null");
        framework = framework == null ? Framework.UNKNOWN : framework;
        routes = routes == null ? List.of() : List.copyOf(routes);
    }

    /**
     * Service for a file whose extraction failed.
     */
    public static Service unparsed(String name, String sourcePath) {
        return new Service(name, null, sourcePath, Framework.UNKNOWN, List.of());
    }
}
