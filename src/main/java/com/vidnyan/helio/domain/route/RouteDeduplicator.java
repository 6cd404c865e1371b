package com.vidnyan.helio.domain.route;

import com.vidnyan.helio.domain.model.Route;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drops routes that repeat an earlier (method, path, handler) key. First-seen order is kept.
 */
public final class RouteDeduplicator {

    private RouteDeduplicator() {
    }

    public static List<Route> deduplicate(List<Route> routes) {
        Set<Route.Key> seen = new HashSet<>();
        List<Route> unique = new ArrayList<>();
        for (Route route : routes) {
            if (seen.add(route.key())) {
                unique.add(route);
            }
        }
        return List.copyOf(unique);
    }
}
