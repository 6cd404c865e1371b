package com.vidnyan.helio.domain.verification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Terminal output of a verification run.
 * Errors, warnings and suggestions are separate channels and are never merged.
 */
public record VerificationResult(
    VerificationOutcome outcome,
    Map<String, Boolean> model,
    List<String> errors,
    List<String> warnings,
    List<String> suggestions
) {

    static final String LOAD_FAILURE_PREFIX = "Failed to load input files: ";

    public VerificationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        suggestions = List.copyOf(suggestions);
        model = outcome == VerificationOutcome.SATISFIABLE && model != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(model))
                : null;
    }

    public boolean satisfiable() {
        return outcome == VerificationOutcome.SATISFIABLE;
    }

    /**
     * Result of a run aborted because an input document could not be loaded.
     */
    public static VerificationResult loadFailure(String detail) {
        return builder()
                .outcome(VerificationOutcome.UNSATISFIABLE)
                .error(LOAD_FAILURE_PREFIX + detail)
                .build();
    }

    public boolean isLoadFailure() {
        return outcome == VerificationOutcome.UNSATISFIABLE
                && errors.size() == 1
                && errors.get(0).startsWith(LOAD_FAILURE_PREFIX)
                && warnings.isEmpty()
                && suggestions.isEmpty();
    }

    /**
     * Builder for VerificationResult.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private VerificationOutcome outcome = VerificationOutcome.UNSATISFIABLE;
        private Map<String, Boolean> model;
        private final List<String> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final List<String> suggestions = new ArrayList<>();

        public Builder outcome(VerificationOutcome outcome) { this.outcome = outcome; return this; }
        public Builder model(Map<String, Boolean> model) { this.model = model; return this; }
        public Builder error(String error) { this.errors.add(error); return this; }
        public Builder errors(List<String> errors) { this.errors.addAll(errors); return this; }
        public Builder warnings(List<String> warnings) { this.warnings.addAll(warnings); return this; }
        public Builder suggestions(List<String> suggestions) { this.suggestions.addAll(suggestions); return this; }

        public VerificationResult build() {
            return new VerificationResult(outcome, model, errors, warnings, suggestions);
        }
    }
}
