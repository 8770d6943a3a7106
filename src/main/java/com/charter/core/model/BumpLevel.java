package com.charter.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which part of a semantic version a bump increments.
 */
public enum BumpLevel {
    PATCH("patch"),
    MINOR("minor"),
    MAJOR("major");

    private final String id;

    BumpLevel(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static BumpLevel fromId(String value) {
        for (BumpLevel candidate : values()) {
            if (candidate.id.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown BumpLevel: " + value);
    }

    @Override
    public String toString() {
        return id;
    }
}
