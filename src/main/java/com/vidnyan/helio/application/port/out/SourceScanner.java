package com.vidnyan.helio.application.port.out;

import com.vidnyan.helio.domain.model.Framework;
import com.vidnyan.helio.domain.model.Route;

import java.nio.file.Path;
import java.util.List;

/**
 * Port for scanning one source file with whichever extractor fits it.
 */
public interface SourceScanner {

    /**
     * Never throws for an unreadable or unparsable file; that file scans as {@link Framework#UNKNOWN}.
     */
    ScannedFile scan(Path file);

    /**
     * Result of scanning one file.
     */
    record ScannedFile(Path file, Framework framework, List<Route> routes, Integer port) {

        public ScannedFile {
            routes = List.copyOf(routes);
        }

        public static ScannedFile unknown(Path file) {
            return new ScannedFile(file, Framework.UNKNOWN, List.of(), null);
        }
    }
}
