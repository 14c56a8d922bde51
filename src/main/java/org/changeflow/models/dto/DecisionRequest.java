package org.changeflow.models.dto;

import jakarta.validation.constraints.NotBlank;

public record DecisionRequest(
        @NotBlank(message = "decision is required") String decision,
        String comment,
        boolean acknowledgeWarnings
) {
}
