package com.charter.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Delivery phase of an RFC. Advances one step at a time.
 */
public enum RfcPhase {
    SPEC("spec"),
    IMPL("impl"),
    TEST("test"),
    STABLE("stable");

    private final String id;

    RfcPhase(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static RfcPhase fromId(String value) {
        for (RfcPhase candidate : values()) {
            if (candidate.id.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown RfcPhase: " + value);
    }

    @Override
    public String toString() {
        return id;
    }
}
