package org.changeflow.models.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record DatasetDTO(
        Long id,
        String datasetUid,
        Long projectId,
        String name,
        String description,
        Map<String, Object> schema,
        List<Map<String, Object>> rules,
        String tableLocation,
        Instant createdAt,
        Instant updatedAt
) {
}
