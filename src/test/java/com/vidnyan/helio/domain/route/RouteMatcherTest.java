package com.vidnyan.helio.domain.route;

import com.vidnyan.helio.domain.model.Route;
import com.vidnyan.helio.domain.model.SpecRoute;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RouteMatcherTest {

    private final List<Route> implementation = List.of(
            Route.builder().name("get_orders").method("GET").path("/orders/").handler("list").build(),
            Route.builder().name("get_orders_id").method("GET").path("/orders/:id").handler("one").build());

    @Test
    void findImplementation_ShouldMatchNormalizedPathAndExactMethod() {
        Optional<Route> match = RouteMatcher.findImplementation(
                new SpecRoute("OrderService", "get_order", "GET", "/orders/{id}"), implementation);

        assertTrue(match.isPresent());
        assertEquals("one", match.get().handler());
    }

    @Test
    void findImplementation_ShouldNotMatchOtherMethods() {
        assertTrue(RouteMatcher.findImplementation(
                new SpecRoute("OrderService", "create_order", "POST", "/orders"), implementation).isEmpty());
    }
}
