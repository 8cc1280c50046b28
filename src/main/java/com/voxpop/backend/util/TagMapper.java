package com.voxpop.backend.util;

import com.voxpop.backend.dto.TagDto;
import com.voxpop.backend.models.Tag;

public class TagMapper {

    public static TagDto toDto(Tag tag, long contactCount) {
        if (tag == null) {
            return null;
        }

        return TagDto.builder()
                .id(tag.getId())
                .name(tag.getName())
                .slug(tag.getSlug())
                .color(tag.getColor())
                .description(tag.getDescription())
                .isSystem(tag.isSystemTag())
                .isActive(tag.isActiveTag())
                .contactCount(contactCount)
                .createdAt(tag.getCreatedAt())
                .updatedAt(tag.getUpdatedAt())
                .build();
    }
}
