package com.vidnyan.helio.domain.analysis;

import java.util.List;

/**
 * Interface for heuristic analyzers.
 * Analyzers run on every verification, independently of the solver outcome.
 */
public interface HeuristicAnalyzer {

    /**
     * Output channel the findings belong to.
     */
    enum Channel {
        WARNING,
        SUGGESTION
    }

    Channel channel();

    /**
     * Produce findings, in a stable order.
     */
    List<String> analyze(AnalysisInput input);

    /**
     * Get the analyzer name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
