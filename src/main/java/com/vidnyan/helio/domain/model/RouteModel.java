package com.vidnyan.helio.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The implementation route model: service name to service, in scan order.
 * Immutable aggregate root of the extraction side.
 */
public record RouteModel(
    Map<String, Service> services
) {

    public RouteModel {
        services = Collections.unmodifiableMap(new LinkedHashMap<>(services));
    }

    public static RouteModel empty() {
        return new RouteModel(Map.of());
    }

    /**
     * All routes of all services, flattened in service order.
     */
    public List<Route> allRoutes() {
        return services.values().stream()
                .flatMap(s -> s.routes().stream())
                .toList();
    }

    public Metadata metadata() {
        return new Metadata(services.size(), allRoutes().size());
    }

    public record Metadata(int totalServices, int totalRoutes) {}
}
