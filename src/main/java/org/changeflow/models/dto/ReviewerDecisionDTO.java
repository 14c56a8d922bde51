package org.changeflow.models.dto;

import java.time.Instant;

public record ReviewerDecisionDTO(
        String reviewer,
        String name,
        String decision,
        Instant decidedAt,
        String comment,
        boolean warningsAcknowledged
) {
}
