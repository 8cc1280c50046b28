package com.voxpop.backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Mutually exclusive classification of a contact, derived from its system tags.
 * Declaration order is the precedence order used when more than one status tag is present.
 */
public enum LifecycleStatus {
    BLACKLIST("blacklist", "Blacklist"),
    APOIADOR("apoiador", "Apoiador"),
    LEAD("lead", "Lead"),
    NONE("sem_status", "Sem status");

    private final String value;
    private final String displayName;

    LifecycleStatus(String value, String displayName) {
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

    public boolean isBlacklisted() {
        return this == BLACKLIST;
    }

    @JsonCreator
    public static LifecycleStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase();
        for (LifecycleStatus status : values()) {
            if (status.value.equals(normalized) || status.name().equalsIgnoreCase(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown contact status: " + value);
    }
}
