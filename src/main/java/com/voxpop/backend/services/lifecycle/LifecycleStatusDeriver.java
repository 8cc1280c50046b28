package com.voxpop.backend.services.lifecycle;

import com.voxpop.backend.enums.LifecycleStatus;
import com.voxpop.backend.enums.SystemTag;
import com.voxpop.backend.models.Contact;
import com.voxpop.backend.models.Tag;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Optional;

/**
 * Maps a tag set to exactly one lifecycle status. Only system tags whose slug is a known
 * {@link SystemTag} count; if more than one is present the most restrictive wins
 * (blacklist, then apoiador, then lead).
 */
public final class LifecycleStatusDeriver {

    private LifecycleStatusDeriver() {
    }

    public static LifecycleStatus derive(Collection<Tag> tags) {
        if (tags == null || tags.isEmpty()) {
            return LifecycleStatus.NONE;
        }

        EnumSet<LifecycleStatus> present = EnumSet.noneOf(LifecycleStatus.class);
        for (Tag tag : tags) {
            if (tag == null) {
                continue;
            }
            Optional<SystemTag> systemTag = tag.asSystemTag();
            systemTag.ifPresent(st -> present.add(st.getStatus()));
        }

        // EnumSet iterates in declaration order, which is the precedence order
        return present.isEmpty() ? LifecycleStatus.NONE : present.iterator().next();
    }

    public static LifecycleStatus derive(Contact contact) {
        return derive(contact.getTags());
    }

    public static boolean isLifecycleTag(Tag tag) {
        return tag != null && tag.asSystemTag().isPresent();
    }
}
