package com.voxpop.backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ContactSource {
    IMPORT("import", "Importação"),
    FORM("form", "Formulário"),
    MANUAL("manual", "Cadastro Manual"),
    API("api", "API");

    private final String value;
    private final String displayName;

    ContactSource(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDisplayName() {
        return displayName;
    }

    @JsonCreator
    public static ContactSource fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase();
        for (ContactSource source : values()) {
            if (source.value.equals(normalized)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown contact source: " + value);
    }
}
