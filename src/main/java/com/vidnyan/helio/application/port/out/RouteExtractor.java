package com.vidnyan.helio.application.port.out;

import com.vidnyan.helio.domain.model.Framework;
import com.vidnyan.helio.domain.model.Route;

import java.nio.file.Path;
import java.util.List;

/**
 * Port for one framework idiom's route extraction.
 * Implementations read nothing but the content they are handed and keep no state between calls.
 */
public interface RouteExtractor {

    /**
     * Idiom this extractor understands; used as the route and service framework label.
     */
    Framework framework();

    /**
     * Extract candidate routes and the declared port from one file's content.
     * @throws SourceParseException if the content cannot be analysed at all
     */
    Extraction extract(Path file, String content) throws SourceParseException;

    /**
     * Routes found in one file, plus the port its server-start call declares, if any.
     */
    record Extraction(List<Route> routes, Integer port) {

        public Extraction {
            routes = List.copyOf(routes);
        }

        public static Extraction empty() {
            return new Extraction(List.of(), null);
        }

        public boolean hasRoutes() {
            return !routes.isEmpty();
        }
    }
}
