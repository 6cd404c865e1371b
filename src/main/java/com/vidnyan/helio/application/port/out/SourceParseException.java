package com.vidnyan.helio.application.port.out;

import java.nio.file.Path;

/**
 * A single source file could not be analysed. Recoverable: the file's service is kept with no routes.
 */
public class SourceParseException extends Exception {

    private final Path file;

    public SourceParseException(Path file, String message) {
        super(message);
        this.file = file;
    }

    public SourceParseException(Path file, String message, Throwable cause) {
        super(message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
