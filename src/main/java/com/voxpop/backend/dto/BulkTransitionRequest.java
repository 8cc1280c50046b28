package com.voxpop.backend.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulkTransitionRequest {

    @NotEmpty(message = "supporterIds must not be empty")
    private List<Long> supporterIds;
}
