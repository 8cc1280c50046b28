package com.voxpop.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TagRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 100, message = "Name must be at most 100 characters")
    private String name;

    @Pattern(regexp = "^$|^[a-z0-9]+(-[a-z0-9]+)*$", message = "Slug may only contain lower-case letters, digits and hyphens")
    private String slug;

    @Pattern(regexp = "^$|^#[0-9A-Fa-f]{6}$", message = "Color must be a hex value like #3B82F6")
    private String color;

    private String description;

    private Boolean isActive;
}
