package com.voxpop.backend.enums;

import java.util.Optional;

/**
 * The closed set of tags that encode lifecycle status. Each constant maps one slug to one status;
 * nothing else in the code base should compare tag slugs against these literals.
 */
public enum SystemTag {
    LEAD("lead", "Lead", "#3B82F6", "Contato inicial - ainda não é apoiador", LifecycleStatus.LEAD),
    APOIADOR("apoiador", "Apoiador", "#22C55E", "Contato engajado - apoiador confirmado", LifecycleStatus.APOIADOR),
    BLACKLIST("blacklist", "Blacklist", "#EF4444", "Não contatar - excluído de campanhas", LifecycleStatus.BLACKLIST);

    private final String slug;
    private final String displayName;
    private final String color;
    private final String description;
    private final LifecycleStatus status;

    SystemTag(String slug, String displayName, String color, String description, LifecycleStatus status) {
        this.slug = slug;
        this.displayName = displayName;
        this.color = color;
        this.description = description;
        this.status = status;
    }

    public String getSlug() { return slug; }
    public String getDisplayName() { return displayName; }
    public String getColor() { return color; }
    public String getDescription() { return description; }
    public LifecycleStatus getStatus() { return status; }

    public static Optional<SystemTag> fromSlug(String slug) {
        if (slug == null) {
            return Optional.empty();
        }
        for (SystemTag tag : values()) {
            if (tag.slug.equals(slug)) {
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }

    public static SystemTag forStatus(LifecycleStatus status) {
        for (SystemTag tag : values()) {
            if (tag.status == status) {
                return tag;
            }
        }
        throw new IllegalArgumentException("No system tag encodes status " + status);
    }
}
