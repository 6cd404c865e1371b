package com.vidnyan.helio.adapter.out.analyzer;

import com.vidnyan.helio.domain.analysis.AnalysisInput;
import com.vidnyan.helio.domain.model.Framework;
import com.vidnyan.helio.domain.model.Route;
import com.vidnyan.helio.domain.model.RouteModel;
import com.vidnyan.helio.domain.model.Service;
import com.vidnyan.helio.domain.model.SpecRoute;
import com.vidnyan.helio.domain.model.Specification;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConsistencyAnalyzerTest {

    private final ConsistencyAnalyzer analyzer = new ConsistencyAnalyzer();

    @Test
    void analyze_ShouldSuggestUnimplementedSpecRoutes() {
        // Arrange
        Specification spec = new Specification(
                List.of("UserService"),
                List.of(
                        new SpecRoute("UserService", "get_user", "GET", "/users/{id}"),
                        new SpecRoute("UserService", "delete_user", "DELETE", "/users/{id}")),
                List.of(), null, List.of());
        Route implemented = Route.builder()
                .name("get_users_id")
                .method("GET")
                .path("/users/:id")
                .handler("getUser")
                .build();
        RouteModel model = new RouteModel(Map.of("Users",
                new Service("Users", null, "users.js", Framework.EXPRESS, List.of(implemented))));

        // Act
        List<String> suggestions = analyzer.analyze(AnalysisInput.of(spec, model));

        // Assert
        assertEquals(List.of("Missing Implementation: Route 'delete_user' (DELETE /users/{id}) is defined in the spec "
                + "for service 'UserService' but is not found in the implementation routes. Consider implementing it."),
                suggestions);
    }

    @Test
    void analyze_ShouldReturnNothingWithoutSpecRoutes() {
        Specification spec = new Specification(List.of(), List.of(), List.of(), null, List.of());

        assertTrue(analyzer.analyze(AnalysisInput.of(spec, RouteModel.empty())).isEmpty());
        assertEquals(ConsistencyAnalyzer.Channel.SUGGESTION, analyzer.channel());
    }
}
