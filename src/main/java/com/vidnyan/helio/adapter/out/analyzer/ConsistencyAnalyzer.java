package com.vidnyan.helio.adapter.out.analyzer;

import com.vidnyan.helio.domain.analysis.AnalysisInput;
import com.vidnyan.helio.domain.analysis.HeuristicAnalyzer;
import com.vidnyan.helio.domain.model.Route;
import com.vidnyan.helio.domain.model.SpecRoute;
import com.vidnyan.helio.domain.route.RouteMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Suggests implementing specification routes that no implementation route serves.
 */
@Slf4j
@Component
@Order(30)
public class ConsistencyAnalyzer implements HeuristicAnalyzer {

    @Override
    public Channel channel() {
        return Channel.SUGGESTION;
    }

    @Override
    public List<String> analyze(AnalysisInput input) {
        List<Route> implementation = input.implementationRoutes();
        List<String> suggestions = new ArrayList<>();

        for (SpecRoute specRoute : input.specification().routes()) {
            if (RouteMatcher.findImplementation(specRoute, implementation).isEmpty()) {
                suggestions.add(String.format(
                        "Missing Implementation: Route '%s' (%s) is defined in the spec for service '%s' "
                                + "but is not found in the implementation routes. Consider implementing it.",
                        specRoute.routeName(), specRoute.describe(), specRoute.service()));
            }
        }

        log.debug("{} of {} spec routes have no implementation",
                suggestions.size(), input.specification().routes().size());
        return suggestions;
    }
}
