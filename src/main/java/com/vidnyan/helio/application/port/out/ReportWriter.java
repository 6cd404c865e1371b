package com.vidnyan.helio.application.port.out;

import com.vidnyan.helio.domain.verification.VerificationResult;

import java.nio.file.Path;

/**
 * Port for persisting the verification result document.
 */
public interface ReportWriter {

    /**
     * @throws ReportWriteException if the document cannot be written
     */
    void write(VerificationResult result, Path resultPath);
}
