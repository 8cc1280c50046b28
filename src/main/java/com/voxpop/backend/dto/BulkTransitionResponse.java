package com.voxpop.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkTransitionResponse {
    private boolean success;
    private String message;
    private int updatedCount;
    private int unchangedCount;
    private int failedCount;
}
