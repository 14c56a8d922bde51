package org.changeflow.models.dto;

import java.time.Instant;
import java.util.Map;

public record ChangeRequestEventDTO(Long id, String type, String actor, String message,
                                    Map<String, Object> metadata, Instant createdAt) {
}
