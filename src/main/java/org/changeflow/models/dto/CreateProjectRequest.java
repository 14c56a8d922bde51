package org.changeflow.models.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateProjectRequest(@NotBlank(message = "Project name is required")
                                   @Size(max = 80, message = "Project name must be at most 80 characters") String name,
                                   @Size(max = 255, message = "Description must be at most 255 characters") String description) {
}
