package com.voxpop.backend.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TagAssignmentRequest {

    @NotEmpty(message = "tagIds must not be empty")
    private List<Long> tagIds;
}
