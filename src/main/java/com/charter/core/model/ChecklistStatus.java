package com.charter.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of one acceptance criterion.
 */
public enum ChecklistStatus {
    PENDING("pending"),
    DONE("done"),
    CANCELLED("cancelled");

    private final String id;

    ChecklistStatus(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static ChecklistStatus fromId(String value) {
        for (ChecklistStatus candidate : values()) {
            if (candidate.id.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ChecklistStatus: " + value);
    }

    @Override
    public String toString() {
        return id;
    }
}
