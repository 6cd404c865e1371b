package com.vidnyan.helio.domain.verification;

import com.vidnyan.helio.domain.analysis.MiddlewareKeywords;
import com.vidnyan.helio.domain.model.Route;
import com.vidnyan.helio.domain.model.SpecRoute;
import com.vidnyan.helio.domain.model.Specification;
import com.vidnyan.helio.domain.route.RouteMatcher;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Encodes a specification and the implementation routes into a {@link ConstraintModel}.
 *
 * <p>One term per declared service and one per (service, spec-route) pair; every route term implies
 * its service term. Each auth-required route then resolves to at most one tracked assumption:
 * {@code MISSING_AUTH} when the matched implementation route has no auth middleware,
 * {@code MISSING_ROUTE} when nothing implements it.</p>
 */
@Slf4j
public class ConstraintModelBuilder {

    public ConstraintModel build(Specification spec, List<Route> implementation) {
        ConstraintModel model = new ConstraintModel();

        Map<String, SymbolicTerm> serviceTerms = new LinkedHashMap<>();
        for (String service : spec.services()) {
            serviceTerms.put(service, model.newTerm("service_" + service));
        }
        for (SpecRoute route : spec.routes()) {
            SymbolicTerm routeTerm = model.newTerm(route.service() + "_" + route.routeName());
            SymbolicTerm serviceTerm = serviceTerms.computeIfAbsent(
                    route.service(), s -> model.newTerm("service_" + s));
            model.addImplication(routeTerm, serviceTerm);
        }

        for (String routeName : new LinkedHashSet<>(spec.policies().authRequired())) {
            Optional<SpecRoute> specRoute = spec.findRoute(routeName);
            if (specRoute.isEmpty()) {
                log.warn("Auth policy names route '{}' which no service declares; skipping", routeName);
                continue;
            }
            addAuthRequirement(model, specRoute.get(), implementation);
        }

        log.debug("Constraint model: {} terms, {} clauses, {} tracked assumptions",
                model.termCount(), model.clauses().size(), model.assumptions().size());
        return model;
    }

    private void addAuthRequirement(ConstraintModel model, SpecRoute specRoute, List<Route> implementation) {
        Optional<Route> impl = RouteMatcher.findImplementation(specRoute, implementation);
        if (impl.isEmpty()) {
            model.track(TrackedAssumption.Kind.MISSING_ROUTE,
                    specRoute.routeName(), specRoute.service(), specRoute.describe());
        } else if (!MiddlewareKeywords.hasAuth(impl.get().middleware())) {
            model.track(TrackedAssumption.Kind.MISSING_AUTH,
                    specRoute.routeName(), specRoute.service(), specRoute.describe());
        }
    }
}
