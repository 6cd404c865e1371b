package com.vidnyan.helio.application.port.out;

import java.nio.file.Path;

/**
 * An output document could not be written.
 */
public class ReportWriteException extends RuntimeException {

    public ReportWriteException(Path target, Throwable cause) {
        super("Failed to write " + target + ": " + cause.getMessage(), cause);
    }
}
