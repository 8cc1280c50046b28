package com.voxpop.backend.util;

import com.voxpop.backend.dto.ImportJobDto;
import com.voxpop.backend.models.ImportJob;

import java.util.ArrayList;
import java.util.LinkedHashMap;

public class ImportJobMapper {

    public static ImportJobDto toDto(ImportJob job) {
        if (job == null) {
            return null;
        }

        return ImportJobDto.builder()
                .id(job.getId())
                .fileName(job.getFileName())
                .status(job.getStatus())
                .totalRows(job.getTotalRows())
                .processedRows(job.getProcessedRows())
                .successCount(job.getSuccessCount())
                .createdCount(job.getCreatedCount())
                .updatedCount(job.getUpdatedCount())
                .skippedCount(job.getSkippedCount())
                .errorCount(job.getErrorCount())
                .errorsLog(new ArrayList<>(job.getErrorsLog()))
                .columnMapping(new LinkedHashMap<>(job.getColumnMapping()))
                .autoTagIds(new ArrayList<>(job.getAutoTagIds()))
                .duplicateMode(job.getDuplicateMode())
                // Derived progress
                .progressPercentage(job.getProgressPercentage())
                .isCompleted(job.isCompleted())
                .durationSeconds(job.getDurationSeconds())
                .createdBy(job.getCreatedBy())
                .createdAt(job.getCreatedAt())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .build();
    }
}
