package org.changeflow.models.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Map;

public record CreateDatasetRequest(
        @NotNull(message = "projectId is required") Long projectId,
        @NotBlank(message = "Dataset name is required")
        @Size(max = 80, message = "Dataset name must be at most 80 characters") String name,
        @Size(max = 255, message = "Description must be at most 255 characters") String description,
        Map<String, Object> schema,
        List<Map<String, Object>> rules
) {
}
