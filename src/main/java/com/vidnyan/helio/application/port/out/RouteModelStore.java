package com.vidnyan.helio.application.port.out;

import com.vidnyan.helio.domain.model.RouteModel;

import java.nio.file.Path;

/**
 * Port for reading and writing the implementation route document.
 */
public interface RouteModelStore {

    /**
     * @throws DocumentLoadException if the document is missing or malformed
     */
    RouteModel read(Path routesPath);

    /**
     * @throws ReportWriteException if the document cannot be written
     */
    void write(RouteModel model, Path routesPath);
}
