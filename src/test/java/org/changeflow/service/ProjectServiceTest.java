package org.changeflow.service;

import org.changeflow.exceptions.ForbiddenException;
import org.changeflow.models.dto.AddMemberRequest;
import org.changeflow.models.dto.ProjectMemberDTO;
import org.changeflow.service.lifecycle.LifecycleTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProjectService Tests")
class ProjectServiceTest extends LifecycleTestSupport {

    private Long newProject() {
        return datasetService.get(newDataset(), OWNER).projectId();
    }

    private Map<String, String> roles(Long projectId) {
        return projectService.listMembers(projectId, OWNER).stream()
                .collect(Collectors.toMap(ProjectMemberDTO::email, ProjectMemberDTO::role));
    }

    @ParameterizedTest
    @ValueSource(strings = {"viewer", "approver", "contributor", "Editor"})
    @DisplayName("The project owner cannot be demoted")
    void testOwnerCannotBeDemoted(String role) {
        Long projectId = newProject();

        assertThrows(IllegalArgumentException.class,
                () -> projectService.upsertMember(projectId, new AddMemberRequest(OWNER, null, role), OWNER));

        assertEquals("owner", roles(projectId).get(OWNER));
        ProjectMemberDTO promoted = projectService.upsertMember(projectId, new AddMemberRequest(BOB, null, "owner"), OWNER);
        assertEquals("owner", promoted.role());
    }

    @Test
    @DisplayName("Re-asserting the owner role is accepted")
    void testOwnerKeepsOwnerRole() {
        Long projectId = newProject();
        assertEquals("owner",
                projectService.upsertMember(projectId, new AddMemberRequest(OWNER, null, "Owner"), OWNER).role());
    }

    @Test
    @DisplayName("A co-owner cannot demote the project owner either")
    void testCoOwnerCannotDemoteOwner() {
        Long projectId = newProject();
        projectService.upsertMember(projectId, new AddMemberRequest(BOB, null, "owner"), OWNER);

        assertThrows(IllegalArgumentException.class,
                () -> projectService.upsertMember(projectId, new AddMemberRequest(OWNER, null, "viewer"), BOB));
        assertEquals("owner", roles(projectId).get(OWNER));
    }

    @Test
    @DisplayName("Owners remove members but not themselves or the project owner")
    void testRemoveMember() {
        Long projectId = newProject();

        projectService.removeMember(projectId, "Bob@Example.com", OWNER);
        assertFalse(roles(projectId).containsKey(BOB));
        assertEquals("approver", roles(projectId).get(CAROL));

        assertThrows(IllegalArgumentException.class, () -> projectService.removeMember(projectId, OWNER, OWNER));
        projectService.upsertMember(projectId, new AddMemberRequest(CAROL, null, "owner"), OWNER);
        assertThrows(IllegalArgumentException.class, () -> projectService.removeMember(projectId, OWNER, CAROL));
        assertThrows(ForbiddenException.class, () -> projectService.removeMember(projectId, VIEWER, REQUESTER));

        ResponseStatusException missing = assertThrows(ResponseStatusException.class,
                () -> projectService.removeMember(projectId, BOB, OWNER));
        assertEquals(HttpStatus.NOT_FOUND, missing.getStatusCode());
    }
}
