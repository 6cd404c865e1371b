package com.vidnyan.helio.application.port.out;

/**
 * A top-level input (document or source tree) is missing or unreadable. Fatal to the run.
 */
public class DocumentLoadException extends RuntimeException {

    public enum DocumentKind {
        SPECIFICATION,
        ROUTES,
        SOURCE_TREE
    }

    private final DocumentKind kind;

    public DocumentLoadException(DocumentKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DocumentLoadException(DocumentKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public DocumentKind getKind() {
        return kind;
    }
}
