package com.ivamare.hostbridge.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of mutation carried by a list update.
 */
public enum ListChangeKind {
    ADD("add", UpdateType.LIST_ADD),
    REMOVE("remove", UpdateType.LIST_REMOVE),
    UPDATE("update", UpdateType.LIST_UPDATE),
    REPLACE("replace", UpdateType.LIST_REPLACE);

    private final String value;
    private final UpdateType updateType;

    ListChangeKind(String value, UpdateType updateType) {
        this.value = value;
        this.updateType = updateType;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public UpdateType updateType() {
        return updateType;
    }

    public static ListChangeKind fromValue(String value) {
        for (ListChangeKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown ListChangeKind: " + value);
    }
}
