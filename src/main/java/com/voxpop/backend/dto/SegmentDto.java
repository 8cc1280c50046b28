package com.voxpop.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SegmentDto {
    private Long id;
    private String name;
    private String description;
    private Map<String, Object> filters;
    private Long cachedCount;
    private Long leadsCount;
    private Long supportersCount;
    private Long blacklistCount;
    private OffsetDateTime cachedAt;
    private Boolean isActive;
    private Long createdBy;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
