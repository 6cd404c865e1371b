package com.vidnyan.helio.application.port.in;

import com.vidnyan.helio.domain.model.RouteModel;

import java.nio.file.Path;
import java.util.List;

/**
 * Use case: turn source files into the implementation route model.
 */
public interface ExtractRoutesUseCase {

    /**
     * Extract routes. Never fails for an individual unparsable file.
     */
    RouteModel extract(ExtractionRequest request);

    /**
     * Extraction request: explicit files, or a root directory to walk when no files are given.
     */
    record ExtractionRequest(
        List<Path> files,
        Path sourceRoot
    ) {
        public static ExtractionRequest forFiles(List<Path> files) {
            return new ExtractionRequest(List.copyOf(files), null);
        }

        public static ExtractionRequest forRoot(Path sourceRoot) {
            return new ExtractionRequest(List.of(), sourceRoot);
        }
    }
}
