package org.changeflow.models.dto;

import java.time.Instant;
import java.util.List;

public record DatasetVersionDTO(
        Long id,
        String changeRequestId,
        String tableLocation,
        long rowCount,
        long rowsAppended,
        List<String> approvers,
        String appliedBy,
        Instant appliedAt
) {
}
