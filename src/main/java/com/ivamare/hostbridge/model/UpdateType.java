package com.ivamare.hostbridge.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Type discriminant of an update envelope.
 */
public enum UpdateType {
    TEXT("text"),
    TERMINAL("terminal"),
    LIST_ADD("list_add"),
    LIST_REMOVE("list_remove"),
    LIST_UPDATE("list_update"),
    LIST_REPLACE("list_replace"),
    PROGRESS("progress");

    private final String value;

    UpdateType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
