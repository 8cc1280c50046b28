package com.voxpop.backend.util;

import com.voxpop.backend.dto.AudiencePreviewDto;
import com.voxpop.backend.dto.SegmentDto;
import com.voxpop.backend.models.Segment;
import com.voxpop.backend.services.audience.AudienceSnapshot;

import java.time.LocalDate;
import java.util.LinkedHashMap;

public class SegmentMapper {

    public static SegmentDto toDto(Segment segment) {
        if (segment == null) {
            return null;
        }

        return SegmentDto.builder()
                .id(segment.getId())
                .name(segment.getName())
                .description(segment.getDescription())
                .filters(segment.getFilters() != null ? new LinkedHashMap<>(segment.getFilters()) : new LinkedHashMap<>())
                .cachedCount(segment.getCachedCount())
                .leadsCount(segment.getLeadsCount())
                .supportersCount(segment.getSupportersCount())
                .blacklistCount(segment.getBlacklistCount())
                .cachedAt(segment.getCachedAt())
                .isActive(segment.getIsActive())
                .createdBy(segment.getCreatedBy())
                .createdAt(segment.getCreatedAt())
                .updatedAt(segment.getUpdatedAt())
                .build();
    }

    public static AudiencePreviewDto toPreview(AudienceSnapshot snapshot, LocalDate today) {
        return AudiencePreviewDto.builder()
                .count(snapshot.count())
                .leadsCount(snapshot.leadsCount())
                .supportersCount(snapshot.supportersCount())
                .blacklistCount(snapshot.blacklistCount())
                .sample(ContactMapper.toDtos(snapshot.sample(), today))
                .build();
    }
}
