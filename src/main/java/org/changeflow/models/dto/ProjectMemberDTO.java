package org.changeflow.models.dto;

public record ProjectMemberDTO(String email, String name, String role) {
}
