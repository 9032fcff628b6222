package com.ivamare.hostbridge.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Delivery priority of an update envelope. Declared in delivery order.
 */
public enum UpdatePriority {
    HIGH("high"),
    NORMAL("normal"),
    LOW("low");

    private final String value;

    UpdatePriority(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static UpdatePriority fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        for (UpdatePriority priority : values()) {
            if (priority.value.equalsIgnoreCase(value)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown UpdatePriority: " + value);
    }
}
