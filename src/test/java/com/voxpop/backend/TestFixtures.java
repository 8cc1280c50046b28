package com.voxpop.backend;

import com.voxpop.backend.enums.SystemTag;
import com.voxpop.backend.models.Contact;
import com.voxpop.backend.models.Tag;

import java.util.Arrays;
import java.util.HashSet;

/**
 * Builders for entities used across unit tests.
 */
public final class TestFixtures {

    public static final Tag LEAD_TAG = systemTag(1L, SystemTag.LEAD);
    public static final Tag APOIADOR_TAG = systemTag(2L, SystemTag.APOIADOR);
    public static final Tag BLACKLIST_TAG = systemTag(3L, SystemTag.BLACKLIST);

    private TestFixtures() {
    }

    public static Tag systemTag(Long id, SystemTag systemTag) {
        return Tag.builder()
                .id(id)
                .name(systemTag.getDisplayName())
                .slug(systemTag.getSlug())
                .color(systemTag.getColor())
                .isSystem(true)
                .build();
    }

    public static Tag systemTag(SystemTag systemTag) {
        switch (systemTag) {
            case LEAD:
                return LEAD_TAG;
            case APOIADOR:
                return APOIADOR_TAG;
            default:
                return BLACKLIST_TAG;
        }
    }

    public static Tag userTag(Long id, String name) {
        return Tag.builder()
                .id(id)
                .name(name)
                .slug(name.toLowerCase().replace(' ', '-'))
                .isSystem(false)
                .build();
    }

    public static Contact contact(Long id, Tag... tags) {
        return Contact.builder()
                .id(id)
                .name("Contact " + id)
                .phone("55119" + String.format("%08d", id))
                .tags(new HashSet<>(Arrays.asList(tags)))
                .build();
    }
}
