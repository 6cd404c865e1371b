package com.vidnyan.helio.adapter.out.scanner.python;

import com.vidnyan.helio.application.port.out.RouteExtractor;
import com.vidnyan.helio.application.port.out.SourceParseException;
import com.vidnyan.helio.domain.model.Route;
import com.vidnyan.helio.domain.route.RouteNaming;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.*;

/**
 * Base for Python idioms that declare routes with decorators on handler functions.
 *
 * <p>The file's event sequence is folded left to right: call bindings grow the set of app-like
 * names, each decorated declaration yields routes for its route markers (every other marker
 * becomes middleware on all of them), and server-start calls set the port. Subclasses decide
 * which constructors, markers and start calls count.</p>
 */
@Slf4j
public abstract class DecoratorRouteExtractor implements RouteExtractor {

    /**
     * Method and path one route marker declares.
     */
    protected record RouteCandidate(String method, String path) {}

    protected record ReceiverCall(String receiver, String attribute, PyExpr.Call call) {}

    @Override
    public Extraction extract(Path file, String content) throws SourceParseException {
        List<SyntaxEvent> events = PythonSyntaxWalker.walk(file, content);
        Extraction extraction = reduce(events);
        log.debug("{}: {} routes in {}", framework().label(), extraction.routes().size(), file);
        return extraction;
    }

    Extraction reduce(List<SyntaxEvent> events) {
        Set<String> appNames = new LinkedHashSet<>(defaultAppNames());
        List<Route> routes = new ArrayList<>();
        Integer port = null;

        for (SyntaxEvent event : events) {
            if (event instanceof SyntaxEvent.BindingIntroduced binding) {
                if (isAppConstructor(binding.value())) {
                    appNames.addAll(binding.targets());
                }
            } else if (event instanceof SyntaxEvent.DeclarationSeen declaration) {
                routes.addAll(routesOf(declaration, appNames));
            } else if (event instanceof SyntaxEvent.CallSeen call) {
                Optional<Integer> declared = serverPort(call.call(), appNames);
                if (declared.isPresent()) {
                    port = declared.get();
                }
            }
        }
        return new Extraction(routes, port);
    }

    private List<Route> routesOf(SyntaxEvent.DeclarationSeen declaration, Set<String> appNames) {
        List<RouteCandidate> candidates = new ArrayList<>();
        List<String> middleware = new ArrayList<>();

        for (PyExpr marker : declaration.markers()) {
            Optional<List<RouteCandidate>> declared = routeMarker(marker, appNames);
            if (declared.isPresent()) {
                candidates.addAll(declared.get());
            } else {
                PyExpr.terminalName(marker).ifPresent(middleware::add);
            }
        }

        return candidates.stream()
                .map(candidate -> Route.builder()
                        .name(RouteNaming.routeName(candidate.method(), candidate.path()))
                        .method(candidate.method())
                        .path(candidate.path())
                        .handler(declaration.function())
                        .middleware(middleware)
                        .framework(framework())
                        .build())
                .toList();
    }

    /**
     * Receiver names recognised before any binding is seen.
     */
    protected abstract Set<String> defaultAppNames();

    protected abstract boolean isAppConstructor(PyExpr.Call value);

    /**
     * Routes the marker declares, or empty when it is not a route marker.
     */
    protected abstract Optional<List<RouteCandidate>> routeMarker(PyExpr marker, Set<String> appNames);

    protected abstract Optional<Integer> serverPort(PyExpr.Call call, Set<String> appNames);

    /**
     * {@code receiver.attr(...)} with a plain-name receiver.
     */
    protected static Optional<ReceiverCall> receiverCall(PyExpr expr) {
        if (expr instanceof PyExpr.Call call && call.func() instanceof PyExpr.Attribute attribute) {
            return PyExpr.receiverName(attribute).map(receiver -> new ReceiverCall(receiver, attribute.attr(), call));
        }
        return Optional.empty();
    }

    protected static Optional<Integer> intKeyword(PyExpr.Call call, String keyword) {
        return call.keyword(keyword)
                .filter(PyExpr.Int.class::isInstance)
                .map(value -> ((PyExpr.Int) value).value());
    }

    protected static String literalPath(Optional<PyExpr> argument) {
        return argument
                .filter(PyExpr.Str.class::isInstance)
                .map(value -> ((PyExpr.Str) value).value().trim())
                .orElse("");
    }
}
