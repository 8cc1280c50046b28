package com.voxpop.backend.dto;

import com.voxpop.backend.enums.DuplicateMode;
import com.voxpop.backend.enums.ImportStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportJobDto {
    private Long id;
    private String fileName;
    private ImportStatus status;
    private Integer totalRows;
    private Integer processedRows;
    private Integer successCount;
    private Integer createdCount;
    private Integer updatedCount;
    private Integer skippedCount;
    private Integer errorCount;
    private List<Map<String, Object>> errorsLog;
    private Map<String, Object> columnMapping;
    private List<Long> autoTagIds;
    private DuplicateMode duplicateMode;
    private Integer progressPercentage;
    private Boolean isCompleted;
    private Long durationSeconds;
    private Long createdBy;
    private OffsetDateTime createdAt;
    private OffsetDateTime startedAt;
    private OffsetDateTime completedAt;
}
