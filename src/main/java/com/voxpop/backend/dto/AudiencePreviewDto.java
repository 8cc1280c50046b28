package com.voxpop.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AudiencePreviewDto {
    private long count;
    private long leadsCount;
    private long supportersCount;
    private long blacklistCount;
    private List<ContactDto> sample;
}
