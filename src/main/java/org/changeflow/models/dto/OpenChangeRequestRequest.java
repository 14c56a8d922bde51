package org.changeflow.models.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Map;

public record OpenChangeRequestRequest(
        @NotNull(message = "datasetId is required") Long datasetId,
        @NotEmpty(message = "At least one reviewer is required") List<String> reviewers,
        @Size(max = 200, message = "Title must be at most 200 characters") String title,
        String description,
        @NotNull(message = "rows are required") List<Map<String, Object>> rows,
        @Size(max = 255, message = "Filename must be at most 255 characters") String filename,
        Long byteLength,
        @Size(max = 64, message = "Checksum must be at most 64 characters") String checksum,
        String comment
) {
}
