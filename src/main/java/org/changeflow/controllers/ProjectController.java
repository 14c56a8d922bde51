package org.changeflow.controllers;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.changeflow.models.dto.AddMemberRequest;
import org.changeflow.models.dto.CreateProjectRequest;
import org.changeflow.models.dto.ProjectDTO;
import org.changeflow.models.dto.ProjectMemberDTO;
import org.changeflow.service.ProjectService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/projects")
@RequiredArgsConstructor
public class ProjectController {

    private final ProjectService projectService;

    @PostMapping
    public ResponseEntity<ProjectDTO> create(@Valid @RequestBody CreateProjectRequest request,
                                             Authentication authentication) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(projectService.create(request, requireUserEmail(authentication)));
    }

    @GetMapping
    public List<ProjectDTO> list(Authentication authentication) {
        return projectService.listForUser(requireUserEmail(authentication));
    }

    @GetMapping("/{projectId}/members")
    public List<ProjectMemberDTO> members(@PathVariable Long projectId, Authentication authentication) {
        return projectService.listMembers(projectId, requireUserEmail(authentication));
    }

    @PostMapping("/{projectId}/members")
    public ProjectMemberDTO upsertMember(@PathVariable Long projectId,
                                         @Valid @RequestBody AddMemberRequest request,
                                         Authentication authentication) {
        return projectService.upsertMember(projectId, request, requireUserEmail(authentication));
    }

    @DeleteMapping("/{projectId}/members/{email}")
    public ResponseEntity<Void> removeMember(@PathVariable Long projectId,
                                             @PathVariable String email,
                                             Authentication authentication) {
        projectService.removeMember(projectId, email, requireUserEmail(authentication));
        return ResponseEntity.noContent().build();
    }

    private String requireUserEmail(Authentication authentication) {
        if (authentication == null || !authentication.isAuthenticated()) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Authentication required");
        }
        return authentication.getName();
    }
}
