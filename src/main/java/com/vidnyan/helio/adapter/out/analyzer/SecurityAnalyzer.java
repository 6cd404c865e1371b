package com.vidnyan.helio.adapter.out.analyzer;

import com.vidnyan.helio.domain.analysis.AnalysisInput;
import com.vidnyan.helio.domain.analysis.HeuristicAnalyzer;
import com.vidnyan.helio.domain.analysis.MiddlewareKeywords;
import com.vidnyan.helio.domain.model.Route;
import com.vidnyan.helio.domain.route.PathNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Flags implementation routes that mutate state without auth middleware, and parameterized
 * routes without validation middleware.
 */
@Slf4j
@Component
@Order(10)
public class SecurityAnalyzer implements HeuristicAnalyzer {

    private static final Set<String> MUTATING_METHODS = Set.of("POST", "PUT", "DELETE");

    @Override
    public Channel channel() {
        return Channel.WARNING;
    }

    @Override
    public List<String> analyze(AnalysisInput input) {
        List<String> warnings = new ArrayList<>();

        for (Route route : input.implementationRoutes()) {
            if (MUTATING_METHODS.contains(route.method()) && !MiddlewareKeywords.hasAuth(route.middleware())) {
                warnings.add(String.format(
                        "Security Warning: Missing authentication on sensitive route %s %s",
                        route.method(), route.path()));
            }
            if (PathNormalizer.hasParameter(route.path()) && !MiddlewareKeywords.hasValidation(route.middleware())) {
                warnings.add(String.format(
                        "Security Warning: Missing input validation on parameterized route %s",
                        route.path()));
            }
        }

        log.debug("Security analysis produced {} warnings", warnings.size());
        return warnings;
    }
}
