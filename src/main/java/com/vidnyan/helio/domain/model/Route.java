package com.vidnyan.helio.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * A single HTTP route found in implementation code.
 * Immutable value object; {@link #key()} is the deduplication identity.
 */
public record Route(
    String name,
    String method,
    String path,
    String handler,
    List<String> middleware,
    Framework framework
) {

    public Route {
        Objects.requireNonNull(method, "method must not be null");
        path = path == null ? "" : path;
        handler = handler == null ? "" : handler;
        middleware = middleware == null ? List.of() : List.copyOf(middleware);
        framework = framework == null ? Framework.UNKNOWN : framework;
    }

    /**
     * Identity used for deduplication: method, path and handler, case-sensitive.
     */
    public Key key() {
        return new Key(method, path, handler);
    }

    public record Key(String method, String path, String handler) {}

    /**
     * Builder for Route.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String method;
        private String path = "";
        private String handler = "";
        private List<String> middleware = List.of();
        private Framework framework = Framework.UNKNOWN;

        public Builder name(String name) { this.name = name; return this; }
        public Builder method(String method) { this.method = method; return this; }
        public Builder path(String path) { this.path = path; return this; }
        public Builder handler(String handler) { this.handler = handler; return this; }
        public Builder middleware(List<String> middleware) { this.middleware = middleware; return this; }
        public Builder framework(Framework framework) { this.framework = framework; return this; }

        public Route build() {
            return new Route(name, method, path, handler, middleware, framework);
        }
    }
}
