package com.charter.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a single clause. Both non-active states are terminal.
 */
public enum ClauseStatus {
    ACTIVE("active"),
    SUPERSEDED("superseded"),
    DEPRECATED("deprecated");

    private final String id;

    ClauseStatus(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static ClauseStatus fromId(String value) {
        for (ClauseStatus candidate : values()) {
            if (candidate.id.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ClauseStatus: " + value);
    }

    public boolean isActive() {
        return this == ACTIVE;
    }

    @Override
    public String toString() {
        return id;
    }
}
