package com.vidnyan.helio.application.port.out;

import com.vidnyan.helio.domain.model.Specification;

import java.nio.file.Path;

/**
 * Port for loading the specification document.
 */
public interface SpecificationLoader {

    /**
     * @throws DocumentLoadException if the document is missing or malformed
     */
    Specification load(Path specPath);
}
