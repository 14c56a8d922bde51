package org.changeflow.models.dto;

import java.time.Instant;

public record DatasetMetaDTO(
        Long datasetId,
        String ownerName,
        long rowCount,
        int columnCount,
        int pendingApprovals,
        String tableLocation,
        Instant lastUpdateAt
) {
}
