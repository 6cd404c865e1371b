package com.vidnyan.helio.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Web-framework idiom a service was extracted with.
 */
public enum Framework {
    EXPRESS("Express.js", Family.JS),
    FASTAPI("FastAPI", Family.PYTHON_DECLARATIVE),
    FLASK("Flask", Family.PYTHON_DECLARATIVE),
    GO("Go", Family.GO),
    SPRING("Spring", Family.JVM),
    MIXED("Mixed", Family.MIXED),
    UNKNOWN("Unknown", Family.UNKNOWN);

    /**
     * Grammar family the idiom belongs to.
     */
    public enum Family {
        JS,
        PYTHON_DECLARATIVE,
        GO,
        JVM,
        MIXED,
        UNKNOWN
    }

    private final String label;
    private final Family family;

    Framework(String label, Family family) {
        this.label = label;
        this.family = family;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public Family family() {
        return family;
    }

    @JsonCreator
    public static Framework fromLabel(String label) {
        if (label == null) {
            return UNKNOWN;
        }
        return Arrays.stream(values())
                .filter(f -> f.label.equalsIgnoreCase(label) || f.name().equalsIgnoreCase(label))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
