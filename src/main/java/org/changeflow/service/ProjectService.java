package org.changeflow.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.changeflow.exceptions.ForbiddenException;
import org.changeflow.models.dto.AddMemberRequest;
import org.changeflow.models.dto.CreateProjectRequest;
import org.changeflow.models.dto.ProjectDTO;
import org.changeflow.models.dto.ProjectMemberDTO;
import org.changeflow.models.entity.ApplicationUser;
import org.changeflow.models.entity.Project;
import org.changeflow.models.entity.ProjectMember;
import org.changeflow.models.enums.ProjectRole;
import org.changeflow.repository.ProjectMemberRepository;
import org.changeflow.repository.ProjectRepository;
import org.changeflow.service.access.ProjectAccessService;
import org.changeflow.utils.AppUtils;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectService {

    private final ProjectRepository projectRepository;
    private final ProjectMemberRepository projectMemberRepository;
    private final ProjectAccessService projectAccessService;
    private final UserService userService;

    @Transactional
    public ProjectDTO create(CreateProjectRequest request, String ownerEmail) {
        ApplicationUser owner = userService.resolve(ownerEmail);
        Project project = new Project();
        project.setProjectUid(AppUtils.generateUUID());
        project.setName(request.name().trim());
        project.setDescription(request.description());
        project.setOwner(owner);
        project.setCreatedAt(Instant.now());
        projectRepository.save(project);

        ProjectMember member = new ProjectMember();
        member.setProject(project);
        member.setUser(owner);
        member.setRole(ProjectRole.OWNER.wireName());
        member.setCreatedAt(Instant.now());
        projectMemberRepository.save(member);
        log.info("Created project {} owned by {}", project.getId(), owner.getEmail());
        return toDto(project, ProjectRole.OWNER);
    }

    @Transactional(readOnly = true)
    public List<ProjectDTO> listForUser(String email) {
        return projectMemberRepository.findAllByUser_EmailIgnoreCase(email).stream()
                .map(member -> toDto(member.getProject(), ProjectRole.normalize(member.getRole()).orElse(null)))
                .toList();
    }

    /**
     * Adds or re-roles a member. Only owners manage membership.
     */
    @Transactional
    public ProjectMemberDTO upsertMember(Long projectId, AddMemberRequest request, String actorEmail) {
        Project project = getRequired(projectId);
        requireOwner(project, actorEmail);
        ProjectRole role = ProjectRole.normalize(request.role())
                .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + request.role()));
        ApplicationUser user = userService.resolve(request.email(), request.name());
        if (isProjectOwner(project, user.getEmail()) && role != ProjectRole.OWNER) {
            throw new IllegalArgumentException("The project owner cannot be demoted");
        }
        ProjectMember member = projectMemberRepository.findByProject_IdAndUser_EmailIgnoreCase(projectId, user.getEmail())
                .orElseGet(() -> {
                    ProjectMember created = new ProjectMember();
                    created.setProject(project);
                    created.setUser(user);
                    created.setCreatedAt(Instant.now());
                    return created;
                });
        member.setRole(role.wireName());
        projectMemberRepository.save(member);
        log.info("Project {} member {} set to {}", projectId, user.getEmail(), role);
        return new ProjectMemberDTO(user.getEmail(), user.getName(), role.wireName());
    }

    /**
     * Removes a member. Owners cannot remove themselves or the project owner.
     */
    @Transactional
    public void removeMember(Long projectId, String memberEmail, String actorEmail) {
        Project project = getRequired(projectId);
        requireOwner(project, actorEmail);
        if (memberEmail.trim().equalsIgnoreCase(actorEmail)) {
            throw new IllegalArgumentException("Members cannot remove themselves");
        }
        if (isProjectOwner(project, memberEmail)) {
            throw new IllegalArgumentException("The project owner cannot be removed");
        }
        ProjectMember member = projectMemberRepository.findByProject_IdAndUser_EmailIgnoreCase(projectId, memberEmail.trim())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Member not found"));
        projectMemberRepository.delete(member);
        log.info("Project {} member {} removed by {}", projectId, member.getUser().getEmail(), actorEmail);
    }

    @Transactional(readOnly = true)
    public List<ProjectMemberDTO> listMembers(Long projectId, String actorEmail) {
        Project project = getRequired(projectId);
        if (!projectAccessService.isMember(actorEmail, project.getId())) {
            throw new ForbiddenException("Not a member of project " + projectId);
        }
        return projectMemberRepository.findAllByProject_IdOrderByIdAsc(projectId).stream()
                .map(member -> new ProjectMemberDTO(
                        member.getUser().getEmail(),
                        member.getUser().getName(),
                        ProjectRole.normalize(member.getRole()).map(ProjectRole::wireName).orElse(member.getRole())))
                .toList();
    }

    public Project getRequired(Long projectId) {
        return projectRepository.findById(projectId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Project not found"));
    }

    private void requireOwner(Project project, String actorEmail) {
        ProjectRole role = projectAccessService.roleOf(actorEmail, project.getId()).orElse(null);
        if (role != ProjectRole.OWNER) {
            throw new ForbiddenException("Only project owners can manage members");
        }
    }

    private boolean isProjectOwner(Project project, String email) {
        return project.getOwner().getEmail().equalsIgnoreCase(email.trim());
    }

    private ProjectDTO toDto(Project project, ProjectRole role) {
        return new ProjectDTO(
                project.getId(),
                project.getProjectUid(),
                project.getName(),
                project.getDescription(),
                project.getOwner().getEmail(),
                role != null ? role.wireName() : null,
                project.getCreatedAt()
        );
    }
}
