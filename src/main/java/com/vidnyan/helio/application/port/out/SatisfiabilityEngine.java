package com.vidnyan.helio.application.port.out;

import com.vidnyan.helio.domain.verification.ConstraintModel;
import com.vidnyan.helio.domain.verification.SolveResult;

import java.time.Duration;

/**
 * Port for the decision procedure.
 * Each call owns a fresh solver context that is discarded when the call returns.
 */
public interface SatisfiabilityEngine {

    /**
     * Decide the model under all of its tracked assumptions.
     *
     * @param model       the constraint model
     * @param deadline    wall-clock budget for the whole call; expiry yields {@link SolveResult.Status#TIMEOUT}
     * @param allCores    when true, keep extracting minimal cores until the remaining assumptions are satisfiable
     */
    SolveResult solve(ConstraintModel model, Duration deadline, boolean allCores);
}
