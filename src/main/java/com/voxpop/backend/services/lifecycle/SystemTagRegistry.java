package com.voxpop.backend.services.lifecycle;

import com.voxpop.backend.enums.SystemTag;
import com.voxpop.backend.models.Tag;
import com.voxpop.backend.repositories.TagRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Resolves the persisted Tag row behind each {@link SystemTag}. The rows are created at startup by
 * {@link SystemTagInitializer}; a missing row means the database is not bootstrapped.
 */
@Component
@RequiredArgsConstructor
public class SystemTagRegistry {

    private final TagRepository tagRepository;

    public Tag resolve(SystemTag systemTag) {
        return tagRepository.findBySlug(systemTag.getSlug())
                .filter(Tag::isSystemTag)
                .orElseThrow(() -> new IllegalStateException(
                        "System tag '" + systemTag.getSlug() + "' is missing; was the database bootstrapped?"));
    }
}
