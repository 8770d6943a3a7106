package com.charter.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of an architecture decision record.
 */
public enum AdrStatus {
    PROPOSED("proposed"),
    ACCEPTED("accepted"),
    REJECTED("rejected"),
    SUPERSEDED("superseded");

    private final String id;

    AdrStatus(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static AdrStatus fromId(String value) {
        for (AdrStatus candidate : values()) {
            if (candidate.id.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown AdrStatus: " + value);
    }

    @Override
    public String toString() {
        return id;
    }
}
