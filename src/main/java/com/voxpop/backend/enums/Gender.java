package com.voxpop.backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Gender {
    M("Masculino"),
    F("Feminino"),
    O("Outro");

    private final String displayName;

    Gender(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getCode() {
        return name();
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Accepts the one-letter code or the Portuguese label ("masculino", "Feminino"), case-insensitive.
     * Returns null for blank input.
     */
    @JsonCreator
    public static Gender fromValue(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        String normalized = value.trim();
        for (Gender gender : values()) {
            if (gender.name().equalsIgnoreCase(normalized) || gender.displayName.equalsIgnoreCase(normalized)) {
                return gender;
            }
        }
        throw new IllegalArgumentException("Unknown gender: " + value);
    }
}
