package org.changeflow.models.dto;

import org.changeflow.service.validation.ValidationReport;

import java.time.Instant;
import java.util.List;

public record ChangeRequestDTO(
        String id,
        Long datasetId,
        String datasetName,
        String requester,
        String title,
        String description,
        String status,
        String mergeState,
        List<ReviewerDecisionDTO> reviewers,
        Integer stagedRowCount,
        String sourceFilename,
        Long sourceBytes,
        String sourceChecksum,
        Integer mergeAttempts,
        String lastMergeError,
        Instant quorumReachedAt,
        Instant mergedAt,
        Instant closedAt,
        Instant createdAt,
        Instant updatedAt,
        ValidationReport validation
) {
}
