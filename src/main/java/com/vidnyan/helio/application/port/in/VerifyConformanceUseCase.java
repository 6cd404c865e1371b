package com.vidnyan.helio.application.port.in;

import com.vidnyan.helio.domain.model.RouteModel;
import com.vidnyan.helio.domain.model.Specification;
import com.vidnyan.helio.domain.verification.VerificationResult;

import java.nio.file.Path;

/**
 * Use case: verify an implementation route model against a specification.
 */
public interface VerifyConformanceUseCase {

    /**
     * Verify already-loaded inputs.
     */
    VerificationResult verify(Specification specification, RouteModel implementation);

    /**
     * Load both documents and verify. A load failure yields an unsatisfiable result with a single
     * error and no heuristic findings.
     */
    VerificationResult verify(Path specPath, Path routesPath);
}
