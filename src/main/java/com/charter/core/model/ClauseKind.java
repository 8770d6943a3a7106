package com.charter.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether a clause states a requirement or only explains.
 */
public enum ClauseKind {
    NORMATIVE("normative"),
    INFORMATIVE("informative");

    private final String id;

    ClauseKind(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static ClauseKind fromId(String value) {
        for (ClauseKind candidate : values()) {
            if (candidate.id.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ClauseKind: " + value);
    }

    @Override
    public String toString() {
        return id;
    }
}
