package com.voxpop.backend.services;

import com.voxpop.backend.dto.TagDto;
import com.voxpop.backend.dto.TagRequest;
import com.voxpop.backend.exceptions.ResourceNotFoundException;
import com.voxpop.backend.exceptions.TagDeletionBlockedException;
import com.voxpop.backend.exceptions.ValidationException;
import com.voxpop.backend.models.Tag;
import com.voxpop.backend.repositories.ContactRepository;
import com.voxpop.backend.repositories.TagRepository;
import com.voxpop.backend.services.campaign.CampaignReferenceChecker;
import com.voxpop.backend.util.TagMapper;
import com.voxpop.backend.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Tag Store. System tags are listed and readable like any other tag but cannot be renamed, disabled,
 * deleted or hand-assigned.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TagService {

    private final TagRepository tagRepository;
    private final ContactRepository contactRepository;
    private final CampaignReferenceChecker campaignReferenceChecker;

    /**
     * @param system null for every tag, otherwise only system (true) or user (false) tags
     */
    @Transactional(readOnly = true)
    public List<TagDto> listTags(Boolean system) {
        List<Tag> tags = system == null
                ? tagRepository.findAllByOrderByIsSystemDescNameAsc()
                : tagRepository.findByIsSystemOrderByNameAsc(system);

        return tags.stream()
                .map(tag -> TagMapper.toDto(tag, contactRepository.countLiveByTagId(tag.getId())))
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public TagDto getTag(Long id) {
        Tag tag = findTag(id);
        return TagMapper.toDto(tag, contactRepository.countLiveByTagId(id));
    }

    @Transactional
    public TagDto createTag(TagRequest request) {
        String name = request.getName().trim();
        if (tagRepository.existsByNameIgnoreCase(name)) {
            throw new ValidationException("name", "A tag named '" + name + "' already exists");
        }

        String slug = resolveSlug(request.getSlug(), name);
        if (tagRepository.existsBySlug(slug)) {
            throw new ValidationException("slug", "A tag with slug '" + slug + "' already exists");
        }

        Tag tag = Tag.builder()
                .name(name)
                .slug(slug)
                .description(request.getDescription())
                .isSystem(false)
                .isActive(request.getIsActive() == null || request.getIsActive())
                .build();
        if (request.getColor() != null && !request.getColor().isBlank()) {
            tag.setColor(request.getColor());
        }

        Tag saved = tagRepository.save(tag);
        log.info("Created tag '{}' (id {})", saved.getSlug(), saved.getId());
        return TagMapper.toDto(saved, 0);
    }

    @Transactional
    public TagDto updateTag(Long id, TagRequest request) {
        Tag tag = findTag(id);
        String name = request.getName().trim();

        if (tag.isSystemTag()) {
            if (!name.equals(tag.getName())) {
                throw new ValidationException("name", "System tags cannot be renamed");
            }
            if (request.getSlug() != null && !request.getSlug().isBlank() && !request.getSlug().equals(tag.getSlug())) {
                throw new ValidationException("slug", "System tags cannot change slug");
            }
            if (Boolean.FALSE.equals(request.getIsActive())) {
                throw new ValidationException("isActive", "System tags cannot be disabled");
            }
        } else {
            if (!name.equalsIgnoreCase(tag.getName()) && tagRepository.existsByNameIgnoreCaseAndIdNot(name, id)) {
                throw new ValidationException("name", "A tag named '" + name + "' already exists");
            }
            tag.setName(name);
            if (request.getSlug() != null && !request.getSlug().isBlank() && !request.getSlug().equals(tag.getSlug())) {
                if (tagRepository.existsBySlug(request.getSlug())) {
                    throw new ValidationException("slug", "A tag with slug '" + request.getSlug() + "' already exists");
                }
                tag.setSlug(request.getSlug());
            }
            if (request.getIsActive() != null) {
                tag.setIsActive(request.getIsActive());
            }
        }

        if (request.getColor() != null && !request.getColor().isBlank()) {
            tag.setColor(request.getColor());
        }
        if (request.getDescription() != null) {
            tag.setDescription(request.getDescription());
        }

        Tag saved = tagRepository.save(tag);
        log.info("Updated tag '{}' (id {})", saved.getSlug(), saved.getId());
        return TagMapper.toDto(saved, contactRepository.countLiveByTagId(id));
    }

    @Transactional
    public void deleteTag(Long id) {
        Tag tag = findTag(id);

        if (tag.isSystemTag()) {
            throw new TagDeletionBlockedException(id, "system tags cannot be deleted");
        }
        if (campaignReferenceChecker.isTagReferenced(id)) {
            throw new TagDeletionBlockedException(id, "it is targeted by a scheduled or running campaign");
        }

        int detached = contactRepository.detachTagFromAllContacts(id);
        tagRepository.delete(tag);
        log.info("Deleted tag '{}' (id {}), removed from {} contacts", tag.getSlug(), id, detached);
    }

    /**
     * Loads tags a caller wants to hand-assign. Every id must name an existing, active, non-system tag.
     *
     * @param field request field to blame on failure
     */
    @Transactional(readOnly = true)
    public Set<Tag> resolveUserTags(Collection<Long> tagIds, String field) {
        if (tagIds == null || tagIds.isEmpty()) {
            return new LinkedHashSet<>();
        }

        Set<Long> wanted = tagIds.stream().filter(Objects::nonNull).collect(Collectors.toCollection(LinkedHashSet::new));
        Map<Long, Tag> found = tagRepository.findAllById(wanted).stream()
                .collect(Collectors.toMap(Tag::getId, Function.identity()));

        List<Long> missing = new ArrayList<>();
        List<Long> system = new ArrayList<>();
        Set<Tag> resolved = new LinkedHashSet<>();
        for (Long tagId : wanted) {
            Tag tag = found.get(tagId);
            if (tag == null || !tag.isActiveTag()) {
                missing.add(tagId);
            } else if (tag.isSystemTag()) {
                system.add(tagId);
            } else {
                resolved.add(tag);
            }
        }

        if (!system.isEmpty()) {
            throw new ValidationException(field, "System tags cannot be assigned manually: " + system);
        }
        if (!missing.isEmpty()) {
            throw new ValidationException(field, "Tags not found or inactive: " + missing);
        }
        return resolved;
    }

    private Tag findTag(Long id) {
        return tagRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Tag", id));
    }

    private String resolveSlug(String requested, String name) {
        if (requested != null && !requested.isBlank()) {
            return requested.trim();
        }
        String slug = TextNormalizer.slugify(name);
        if (slug.isEmpty()) {
            throw new ValidationException("name", "Name must contain at least one letter or digit");
        }
        return slug;
    }
}
