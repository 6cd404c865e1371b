package com.vidnyan.helio.domain.route;

import com.vidnyan.helio.domain.model.Route;
import com.vidnyan.helio.domain.model.SpecRoute;

import java.util.List;
import java.util.Optional;

/**
 * Finds the implementation route serving a specification route: exact method, normalized path.
 */
public final class RouteMatcher {

    private RouteMatcher() {
    }

    public static Optional<Route> findImplementation(SpecRoute specRoute, List<Route> implementation) {
        String specPath = PathNormalizer.normalize(specRoute.path());
        return implementation.stream()
                .filter(r -> r.method().equals(specRoute.method()))
                .filter(r -> PathNormalizer.normalize(r.path()).equals(specPath))
                .findFirst();
    }
}
