package com.charter.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a work item.
 */
public enum WorkItemStatus {
    QUEUE("queue"),
    ACTIVE("active"),
    DONE("done"),
    CANCELLED("cancelled");

    private final String id;

    WorkItemStatus(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static WorkItemStatus fromId(String value) {
        for (WorkItemStatus candidate : values()) {
            if (candidate.id.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown WorkItemStatus: " + value);
    }

    /** Done and cancelled items never change again. */
    public boolean isTerminal() {
        return this == DONE || this == CANCELLED;
    }

    @Override
    public String toString() {
        return id;
    }
}
