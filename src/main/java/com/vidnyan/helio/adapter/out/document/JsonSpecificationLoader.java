package com.vidnyan.helio.adapter.out.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.helio.application.port.out.DocumentLoadException;
import com.vidnyan.helio.application.port.out.DocumentLoadException.DocumentKind;
import com.vidnyan.helio.application.port.out.SpecificationLoader;
import com.vidnyan.helio.domain.model.CommunicationEdge;
import com.vidnyan.helio.domain.model.SpecRoute;
import com.vidnyan.helio.domain.model.Specification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Loads the specification document from JSON.
 *
 * <p>Communications are accepted as structured objects ({@code {source, target, type}}) and as
 * legacy strings ({@code "A -> B: GET /path"}). Routes without a method or path are skipped.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonSpecificationLoader implements SpecificationLoader {

    private static final Pattern ASYNC_WORD = Pattern.compile("\\basync\\b", Pattern.CASE_INSENSITIVE);

    private final ObjectMapper objectMapper;

    @Override
    public Specification load(Path specPath) {
        if (specPath == null || !Files.isRegularFile(specPath)) {
            throw new DocumentLoadException(DocumentKind.SPECIFICATION, "Specification not found: " + specPath);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(specPath.toFile());
        } catch (IOException e) {
            throw new DocumentLoadException(DocumentKind.SPECIFICATION,
                    "Malformed specification " + specPath + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new DocumentLoadException(DocumentKind.SPECIFICATION,
                    "Specification " + specPath + " is not a JSON object");
        }

        List<String> services = new ArrayList<>();
        List<SpecRoute> routes = new ArrayList<>();
        readServices(root.path("services"), services, routes);

        List<CommunicationEdge> communications = readCommunications(root.path("communications"));
        Specification.Policies policies = readPolicies(root.path("policies"));
        List<String> properties = readStrings(root.path("properties"));

        log.info("Loaded specification: {} services, {} routes, {} communications, {} auth-required routes",
                services.size(), routes.size(), communications.size(), policies.authRequired().size());
        return new Specification(services, routes, communications, policies, properties);
    }

    private void readServices(JsonNode servicesNode, List<String> services, List<SpecRoute> routes) {
        Iterator<Map.Entry<String, JsonNode>> serviceFields = servicesNode.fields();
        while (serviceFields.hasNext()) {
            Map.Entry<String, JsonNode> service = serviceFields.next();
            services.add(service.getKey());

            Iterator<Map.Entry<String, JsonNode>> routeFields = service.getValue().path("routes").fields();
            while (routeFields.hasNext()) {
                Map.Entry<String, JsonNode> route = routeFields.next();
                String method = route.getValue().path("method").asText("");
                String path = route.getValue().path("path").asText("");
                if (method.isEmpty() || path.isEmpty()) {
                    log.debug("Skipping spec route {}.{} without method or path", service.getKey(), route.getKey());
                    continue;
                }
                routes.add(new SpecRoute(service.getKey(), route.getKey(), method.toUpperCase(Locale.ROOT), path));
            }
        }
    }

    private List<CommunicationEdge> readCommunications(JsonNode node) {
        List<CommunicationEdge> edges = new ArrayList<>();
        for (JsonNode comm : node) {
            if (comm.isObject()) {
                String source = comm.path("source").asText("");
                String target = comm.path("target").asText("");
                if (!source.isEmpty() && !target.isEmpty()) {
                    edges.add(new CommunicationEdge(source, target,
                            CommunicationEdge.Kind.parse(comm.path("type").asText(null))));
                }
            } else if (comm.isTextual()) {
                parseLegacyEdge(comm.asText()).ifPresentOrElse(edges::add,
                        () -> log.warn("Ignoring unparsable communication entry: {}", comm.asText()));
            }
        }
        return edges;
    }

    /**
     * Parse {@code "A -> B: METHOD /path"}. Legacy entries describe request/response calls, so they
     * are sync unless they say {@code async}.
     */
    static Optional<CommunicationEdge> parseLegacyEdge(String entry) {
        String[] parts = entry.split("->");
        if (parts.length != 2) {
            return Optional.empty();
        }
        String left = parts[0].trim();
        String right = parts[1].trim();
        if (left.isEmpty() || right.isEmpty()) {
            return Optional.empty();
        }
        String source = left.split("\\s+")[0];
        String target = right.split(":")[0].trim();
        if (target.isEmpty()) {
            return Optional.empty();
        }
        CommunicationEdge.Kind kind = ASYNC_WORD.matcher(entry).find()
                ? CommunicationEdge.Kind.ASYNC
                : CommunicationEdge.Kind.SYNC;
        return Optional.of(new CommunicationEdge(source, target, kind));
    }

    private Specification.Policies readPolicies(JsonNode policies) {
        List<String> authRequired = readStrings(policies.path("authRequired"));
        JsonNode timeout = policies.path("timeout");
        int timeoutEntries;
        if (timeout.isMissingNode() || timeout.isNull()) {
            timeoutEntries = 0;
        } else if (timeout.isContainerNode()) {
            timeoutEntries = timeout.size();
        } else {
            timeoutEntries = 1;
        }
        return new Specification.Policies(authRequired, timeoutEntries);
    }

    private List<String> readStrings(JsonNode node) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (item.isValueNode()) {
                values.add(item.asText());
            }
        }
        return values;
    }
}
