package com.voxpop.backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What the import worker does with a row whose phone already belongs to a contact.
 */
public enum DuplicateMode {
    UPDATE("update"),
    SKIP("skip");

    private final String value;

    DuplicateMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DuplicateMode fromValue(String value) {
        if (value == null || value.trim().isEmpty()) {
            return UPDATE;
        }
        String normalized = value.trim().toLowerCase();
        for (DuplicateMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown duplicate mode: " + value);
    }
}
