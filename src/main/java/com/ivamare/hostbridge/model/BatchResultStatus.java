package com.ivamare.hostbridge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of one call inside a batch response.
 */
public enum BatchResultStatus {
    OK("ok"),
    ERROR("error");

    private final String value;

    BatchResultStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static BatchResultStatus fromValue(String value) {
        for (BatchResultStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown BatchResultStatus: " + value);
    }
}
