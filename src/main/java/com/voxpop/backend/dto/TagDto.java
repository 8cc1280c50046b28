package com.voxpop.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TagDto {
    private Long id;
    private String name;
    private String slug;
    private String color;
    private String description;
    private Boolean isSystem;
    private Boolean isActive;
    private Long contactCount;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
