package org.changeflow.models.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AddMemberRequest(
        @NotBlank(message = "Email is required") @Email(message = "Email must be valid")
        @Size(max = 120, message = "Email must be at most 120 characters") String email,
        @Size(max = 60, message = "Name must be at most 60 characters") String name,
        @NotBlank(message = "Role is required") String role
) {
}
