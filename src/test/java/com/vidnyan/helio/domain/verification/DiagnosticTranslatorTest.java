package com.vidnyan.helio.domain.verification;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTranslatorTest {

    private final DiagnosticTranslator translator = new DiagnosticTranslator();

    @Test
    void translate_ShouldDescribeEachBlamedAssumption() {
        ConstraintModel model = new ConstraintModel();
        model.newTerm("service_OrderService");
        TrackedAssumption auth = model.track(
                TrackedAssumption.Kind.MISSING_AUTH, "create_order", "OrderService", "POST /orders");
        TrackedAssumption route = model.track(
                TrackedAssumption.Kind.MISSING_ROUTE, "delete_order", "OrderService", "DELETE /orders/:id");

        List<String> errors = translator.translate(model, SolveResult.unsatisfiable(List.of(
                List.of(auth.term().id()), List.of(route.term().id()))));

        assertEquals(2, errors.size());
        assertEquals("Policy Violation: Authentication is required for route 'create_order' "
                + "(POST /orders in OrderService) but is not implemented in its middleware.", errors.get(0));
        assertEquals("Policy Violation: The route 'delete_order' (DELETE /orders/:id in OrderService), "
                + "which requires authentication, is not implemented.", errors.get(1));
    }

    @Test
    void translate_ShouldReturnGenericMessageWithoutCore() {
        List<String> errors = translator.translate(new ConstraintModel(),
                SolveResult.unsatisfiableWithoutCore("conflict"));

        assertEquals(List.of(DiagnosticTranslator.UNRESOLVED_CONFLICT), errors);
    }

    @Test
    void translate_ShouldNameUntrackedTerms() {
        ConstraintModel model = new ConstraintModel();
        SymbolicTerm service = model.newTerm("service_OrderService");

        List<String> errors = translator.translate(model, SolveResult.unsatisfiable(List.of(List.of(service.id()))));

        assertEquals(List.of("Unsatisfiable Constraint: service_OrderService"), errors);
    }
}
