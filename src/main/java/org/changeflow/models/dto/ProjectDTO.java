package org.changeflow.models.dto;

import java.time.Instant;

public record ProjectDTO(Long id, String projectUid, String name, String description, String owner,
                         String role, Instant createdAt) {
}
