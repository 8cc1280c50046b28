package com.voxpop.backend.services.audience;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of keys a filter specification may constrain. Wire names are the keys stored in
 * segment filters; aliases are accepted on input.
 */
public enum FilterKey {
    CONTACT_STATUS("contact_status", ValueKind.TEXT, "status"),
    CITY("city", ValueKind.TEXT),
    STATE("state", ValueKind.TEXT),
    NEIGHBORHOOD("neighborhood", ValueKind.TEXT),
    GENDER("gender", ValueKind.TEXT),
    TAGS_ANY("tags", ValueKind.ID_LIST, "tags_any"),
    TAGS_ALL("tags_all", ValueKind.ID_LIST),
    AGE_MIN("age_min", ValueKind.NUMBER),
    AGE_MAX("age_max", ValueKind.NUMBER),
    ELECTORAL_ZONE("electoral_zone", ValueKind.TEXT),
    ELECTORAL_SECTION("electoral_section", ValueKind.TEXT),
    SOURCE("source", ValueKind.TEXT),
    WHATSAPP_OPT_IN("whatsapp_opt_in", ValueKind.FLAG);

    public enum ValueKind {
        TEXT, NUMBER, ID_LIST, FLAG
    }

    private final String wireName;
    private final ValueKind kind;
    private final List<String> aliases;

    FilterKey(String wireName, ValueKind kind, String... aliases) {
        this.wireName = wireName;
        this.kind = kind;
        this.aliases = Arrays.asList(aliases);
    }

    public String getWireName() {
        return wireName;
    }

    public ValueKind getKind() {
        return kind;
    }

    /**
     * Looks a key up by wire name or alias. Case and hyphen/underscore differences are ignored,
     * so "tags-any" and "TAGS_ANY" both resolve.
     */
    public static Optional<FilterKey> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (FilterKey key : values()) {
            if (key.wireName.equals(normalized) || key.aliases.contains(normalized)) {
                return Optional.of(key);
            }
        }
        return Optional.empty();
    }
}
