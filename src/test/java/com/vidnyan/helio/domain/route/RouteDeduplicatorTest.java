package com.vidnyan.helio.domain.route;

import com.vidnyan.helio.domain.model.Route;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RouteDeduplicatorTest {

    @Test
    void deduplicate_ShouldKeepFirstRouteForEachKey() {
        Route first = route("GET", "/users", "listUsers", List.of("auth"));
        Route repeated = route("GET", "/users", "listUsers", List.of());
        Route otherHandler = route("GET", "/users", "listUsersV2", List.of());
        Route otherMethod = route("POST", "/users", "listUsers", List.of());

        List<Route> unique = RouteDeduplicator.deduplicate(List.of(first, repeated, otherHandler, otherMethod));

        assertEquals(List.of(first, otherHandler, otherMethod), unique);
    }

    @Test
    void deduplicate_ShouldTreatKeyCaseSensitively() {
        List<Route> unique = RouteDeduplicator.deduplicate(List.of(
                route("GET", "/Users", "h", List.of()),
                route("GET", "/users", "h", List.of())));

        assertEquals(2, unique.size());
    }

    private Route route(String method, String path, String handler, List<String> middleware) {
        return Route.builder()
                .name(RouteNaming.routeName(method, path))
                .method(method)
                .path(path)
                .handler(handler)
                .middleware(middleware)
                .build();
    }
}
