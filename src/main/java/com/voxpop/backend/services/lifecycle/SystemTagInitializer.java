package com.voxpop.backend.services.lifecycle;

import com.voxpop.backend.enums.SystemTag;
import com.voxpop.backend.models.Tag;
import com.voxpop.backend.repositories.TagRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Creates any missing system tag on startup. Existing rows are upgraded to system tags if a user
 * created a tag with the same slug before bootstrap.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SystemTagInitializer implements ApplicationRunner {

    private final TagRepository tagRepository;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        for (SystemTag systemTag : SystemTag.values()) {
            ensure(systemTag);
        }
    }

    void ensure(SystemTag systemTag) {
        Optional<Tag> existing = tagRepository.findBySlug(systemTag.getSlug());
        if (existing.isPresent()) {
            Tag tag = existing.get();
            if (!tag.isSystemTag()) {
                log.warn("Tag '{}' (id {}) claimed as system tag", tag.getSlug(), tag.getId());
                tag.setIsSystem(true);
                tag.setIsActive(true);
                tagRepository.save(tag);
            }
            return;
        }

        Tag created = tagRepository.save(Tag.builder()
                .name(systemTag.getDisplayName())
                .slug(systemTag.getSlug())
                .color(systemTag.getColor())
                .description(systemTag.getDescription())
                .isSystem(true)
                .isActive(true)
                .build());
        log.info("Created system tag '{}' with id {}", created.getSlug(), created.getId());
    }
}
