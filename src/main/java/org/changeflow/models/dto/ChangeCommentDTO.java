package org.changeflow.models.dto;

import java.time.Instant;

public record ChangeCommentDTO(Long id, String author, String authorName, String body, Instant createdAt) {
}
