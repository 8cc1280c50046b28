package com.voxpop.backend.dto;

import com.voxpop.backend.enums.LifecycleStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransitionResponse {
    private Long contactId;
    private LifecycleStatus previousStatus;
    private LifecycleStatus contactStatus;
    private boolean changed;
    private String message;
}
