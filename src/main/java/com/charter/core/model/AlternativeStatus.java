package com.charter.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of an alternative considered by an ADR.
 */
public enum AlternativeStatus {
    CONSIDERED("considered"),
    ACCEPTED("accepted"),
    REJECTED("rejected");

    private final String id;

    AlternativeStatus(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static AlternativeStatus fromId(String value) {
        for (AlternativeStatus candidate : values()) {
            if (candidate.id.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown AlternativeStatus: " + value);
    }

    @Override
    public String toString() {
        return id;
    }
}
