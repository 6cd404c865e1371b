package com.vidnyan.helio.domain.model;

import java.util.Locale;

/**
 * A declared communication between two services.
 */
public record CommunicationEdge(
    String source,
    String target,
    Kind kind
) {

    public enum Kind {
        SYNC,
        ASYNC,
        UNKNOWN;

        public static Kind parse(String value) {
            if (value == null) {
                return UNKNOWN;
            }
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "sync", "synchronous" -> SYNC;
                case "async", "asynchronous" -> ASYNC;
                default -> UNKNOWN;
            };
        }
    }

    public boolean isSync() {
        return kind == Kind.SYNC;
    }
}
