package com.vidnyan.helio.domain.verification;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps blamed assumption terms back to human-readable violation messages by direct lookup
 * in the model's assumption table.
 */
public class DiagnosticTranslator {

    static final String UNRESOLVED_CONFLICT =
            "Could not determine the unsatisfiable core. The constraints may have a fundamental conflict.";

    public List<String> translate(ConstraintModel model, SolveResult result) {
        if (!result.hasCores()) {
            return List.of(UNRESOLVED_CONFLICT);
        }
        List<String> errors = new ArrayList<>();
        for (List<Integer> core : result.cores()) {
            for (Integer termId : core) {
                errors.add(model.assumptionFor(termId)
                        .map(DiagnosticTranslator::describe)
                        .orElseGet(() -> "Unsatisfiable Constraint: " + termName(model, termId)));
            }
        }
        return errors;
    }

    static String describe(TrackedAssumption assumption) {
        return switch (assumption.kind()) {
            case MISSING_AUTH -> String.format(
                    "Policy Violation: Authentication is required for route '%s' (%s in %s) "
                            + "but is not implemented in its middleware.",
                    assumption.subject(), assumption.requirement(), assumption.service());
            case MISSING_ROUTE -> String.format(
                    "Policy Violation: The route '%s' (%s in %s), which requires authentication, "
                            + "is not implemented.",
                    assumption.subject(), assumption.requirement(), assumption.service());
        };
    }

    private static String termName(ConstraintModel model, int termId) {
        return model.terms().stream()
                .filter(t -> t.id() == termId)
                .map(SymbolicTerm::name)
                .findFirst()
                .orElse("#" + termId);
    }
}
