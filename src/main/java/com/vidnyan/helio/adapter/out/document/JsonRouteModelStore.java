package com.vidnyan.helio.adapter.out.document;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.helio.application.port.out.DocumentLoadException;
import com.vidnyan.helio.application.port.out.DocumentLoadException.DocumentKind;
import com.vidnyan.helio.application.port.out.ReportWriteException;
import com.vidnyan.helio.application.port.out.RouteModelStore;
import com.vidnyan.helio.domain.model.Framework;
import com.vidnyan.helio.domain.model.Route;
import com.vidnyan.helio.domain.model.RouteModel;
import com.vidnyan.helio.domain.model.Service;
import com.vidnyan.helio.domain.route.RouteNaming;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * JSON implementation route document:
 * {@code {services: {name: {port, file_path, framework, routes: [...]}}, metadata: {total_services, total_routes}}}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonRouteModelStore implements RouteModelStore {

    private final ObjectMapper objectMapper;

    @Override
    public RouteModel read(Path routesPath) {
        if (routesPath == null || !Files.isRegularFile(routesPath)) {
            throw new DocumentLoadException(DocumentKind.ROUTES, "Routes document not found: " + routesPath);
        }

        RouteDocumentDto dto;
        try {
            dto = objectMapper.readValue(routesPath.toFile(), RouteDocumentDto.class);
        } catch (IOException e) {
            throw new DocumentLoadException(DocumentKind.ROUTES,
                    "Malformed routes document " + routesPath + ": " + e.getMessage(), e);
        }
        if (dto == null || dto.services == null) {
            throw new DocumentLoadException(DocumentKind.ROUTES, "Routes document " + routesPath + " has no services");
        }

        Map<String, Service> services = new LinkedHashMap<>();
        dto.services.forEach((name, service) -> services.put(name, mapToService(name, service)));

        RouteModel model = new RouteModel(services);
        log.info("Loaded routes document: {} services, {} routes",
                model.metadata().totalServices(), model.metadata().totalRoutes());
        return model;
    }

    @Override
    public void write(RouteModel model, Path routesPath) {
        RouteDocumentDto dto = new RouteDocumentDto();
        model.services().forEach((name, service) -> dto.services.put(name, mapToDto(service)));
        dto.metadata = new MetadataDto();
        dto.metadata.totalServices = model.metadata().totalServices();
        dto.metadata.totalRoutes = model.metadata().totalRoutes();

        try {
            Path parent = routesPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(routesPath.toFile(), dto);
        } catch (IOException e) {
            throw new ReportWriteException(routesPath, e);
        }
        log.info("Routes written to {}", routesPath);
    }

    private Service mapToService(String name, ServiceDto dto) {
        if (dto == null) {
            throw new DocumentLoadException(DocumentKind.ROUTES, "Service " + name + " has no body");
        }
        Framework framework = Framework.fromLabel(dto.framework);
        List<Route> routes = new ArrayList<>();
        for (RouteDto route : dto.routes != null ? dto.routes : List.<RouteDto>of()) {
            if (route == null) {
                throw new DocumentLoadException(DocumentKind.ROUTES, "Null route entry in service " + name);
            }
            if (route.middleware != null && route.middleware.contains(null)) {
                throw new DocumentLoadException(DocumentKind.ROUTES,
                        "Null middleware entry on " + route.method + " " + route.path + " in service " + name);
            }
            if (route.method == null || route.method.isBlank()) {
                throw new DocumentLoadException(DocumentKind.ROUTES, "Route without method in service " + name);
            }
            String method = route.method.toUpperCase(Locale.ROOT);
            String path = route.path != null ? route.path : "";
            routes.add(Route.builder()
                    .name(route.name != null ? route.name : RouteNaming.routeName(method, path))
                    .method(method)
                    .path(path)
                    .handler(route.handler)
                    .middleware(route.middleware != null ? route.middleware : List.of())
                    .framework(route.framework != null ? Framework.fromLabel(route.framework) : framework)
                    .build());
        }
        return new Service(name, dto.port, dto.filePath, framework, routes);
    }

    private ServiceDto mapToDto(Service service) {
        ServiceDto dto = new ServiceDto();
        dto.port = service.port();
        dto.filePath = service.sourcePath();
        dto.framework = service.framework().label();
        dto.routes = service.routes().stream().map(route -> {
            RouteDto r = new RouteDto();
            r.name = route.name();
            r.method = route.method();
            r.path = route.path();
            r.middleware = route.middleware();
            r.handler = route.handler();
            r.framework = route.framework().label();
            return r;
        }).toList();
        return dto;
    }

    // DTO classes for JSON (de)serialization
    static class RouteDocumentDto {
        public Map<String, ServiceDto> services = new LinkedHashMap<>();
        public MetadataDto metadata;
    }

    static class ServiceDto {
        public Integer port;
        @JsonProperty("file_path")
        public String filePath;
        public String framework;
        public List<RouteDto> routes;
    }

    static class RouteDto {
        public String name;
        public String method;
        public String path;
        public List<String> middleware;
        public String handler;
        public String framework;
    }

    static class MetadataDto {
        @JsonProperty("total_services")
        public int totalServices;
        @JsonProperty("total_routes")
        public int totalRoutes;
    }
}
