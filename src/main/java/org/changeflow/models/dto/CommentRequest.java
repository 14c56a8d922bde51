package org.changeflow.models.dto;

import jakarta.validation.constraints.NotBlank;

public record CommentRequest(@NotBlank(message = "Comment body is required") String body) {
}
