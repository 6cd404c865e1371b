package com.vidnyan.helio.domain.analysis;

import com.vidnyan.helio.domain.graph.CommunicationGraph;
import com.vidnyan.helio.domain.model.Route;
import com.vidnyan.helio.domain.model.RouteModel;
import com.vidnyan.helio.domain.model.Specification;

import java.util.List;

/**
 * Input shared by all heuristic analyzers.
 */
public record AnalysisInput(
    Specification specification,
    RouteModel implementation,
    CommunicationGraph syncGraph
) {

    public static AnalysisInput of(Specification specification, RouteModel implementation) {
        return new AnalysisInput(specification, implementation,
                CommunicationGraph.ofSyncEdges(specification.communications()));
    }

    public List<Route> implementationRoutes() {
        return implementation.allRoutes();
    }
}
