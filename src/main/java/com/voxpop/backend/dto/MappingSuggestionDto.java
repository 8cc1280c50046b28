package com.voxpop.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MappingSuggestionDto {
    private String fileName;
    private List<String> headers;
    // header -> canonical field, only for headers that matched
    private Map<String, String> suggestedMapping;
    private List<Map<String, String>> sampleRows;
    private int totalRows;
    // canonical field -> label
    private Map<String, String> availableFields;
}
