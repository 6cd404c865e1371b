package com.vidnyan.helio.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * Normalized specification document: intended services, routes, communications and policies.
 * Read-only input of a verification run.
 */
public record Specification(
    List<String> services,
    List<SpecRoute> routes,
    List<CommunicationEdge> communications,
    Policies policies,
    List<String> properties
) {

    public Specification {
        services = List.copyOf(services);
        routes = List.copyOf(routes);
        communications = List.copyOf(communications);
        policies = policies == null ? Policies.none() : policies;
        properties = properties == null ? List.of() : List.copyOf(properties);
    }

    /**
     * Policy section. {@code timeoutEntries} counts whatever entries the timeout policy holds.
     */
    public record Policies(List<String> authRequired, int timeoutEntries) {

        public Policies {
            authRequired = authRequired == null ? List.of() : List.copyOf(authRequired);
        }

        public static Policies none() {
            return new Policies(List.of(), 0);
        }

        public boolean hasTimeouts() {
            return timeoutEntries > 0;
        }
    }

    /**
     * First spec route with the given name, in declaration order.
     */
    public Optional<SpecRoute> findRoute(String routeName) {
        return routes.stream()
                .filter(r -> r.routeName().equals(routeName))
                .findFirst();
    }
}
