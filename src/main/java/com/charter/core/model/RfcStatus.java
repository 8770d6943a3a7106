package com.charter.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of an RFC. Only moves forward: draft, normative, deprecated.
 */
public enum RfcStatus {
    DRAFT("draft"),
    NORMATIVE("normative"),
    DEPRECATED("deprecated");

    private final String id;

    RfcStatus(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static RfcStatus fromId(String value) {
        for (RfcStatus candidate : values()) {
            if (candidate.id.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown RfcStatus: " + value);
    }

    @Override
    public String toString() {
        return id;
    }
}
