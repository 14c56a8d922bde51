package org.changeflow.service.access;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.changeflow.exceptions.ForbiddenException;
import org.changeflow.models.entity.ChangeRequest;
import org.changeflow.models.entity.Dataset;
import org.changeflow.models.enums.GateAction;
import org.changeflow.models.enums.ProjectRole;
import org.changeflow.repository.ProjectMemberRepository;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectAccessService {

    private final ProjectMemberRepository projectMemberRepository;

    public Optional<ProjectRole> roleOf(String actorEmail, Long projectId) {
        if (actorEmail == null || projectId == null) {
            return Optional.empty();
        }
        return projectMemberRepository.findByProject_IdAndUser_EmailIgnoreCase(projectId, actorEmail)
                .flatMap(member -> ProjectRole.normalize(member.getRole()));
    }

    public boolean isMember(String actorEmail, Long projectId) {
        return roleOf(actorEmail, projectId).isPresent();
    }

    public ProjectRole require(String actorEmail, Dataset dataset, GateAction action) {
        ProjectRole role = roleOf(actorEmail, dataset.getProject().getId()).orElse(null);
        if (!AccessGate.allowed(role, action)) {
            log.warn("Access denied: actor={} action={} dataset={} role={}", actorEmail, action, dataset.getId(), role);
            throw new ForbiddenException("Not allowed to " + describe(action) + " on dataset " + dataset.getId());
        }
        return role;
    }

    /**
     * An assigned reviewer may decide regardless of role; anyone else needs the approver role. An approver
     * who is not assigned passes this check and is turned away by the quorum tracker.
     */
    public void requireDecide(String actorEmail, ChangeRequest changeRequest) {
        if (changeRequest.decisionOf(actorEmail).isPresent()) {
            return;
        }
        require(actorEmail, changeRequest.getDataset(), GateAction.DECIDE);
    }

    public void requireWithdraw(String actorEmail, ChangeRequest changeRequest) {
        if (!changeRequest.isRequestedBy(actorEmail)) {
            log.warn("Withdraw denied: actor={} is not the requester of {}", actorEmail, changeRequest.getChangeRequestUid());
            throw new ForbiddenException("Only the requester can withdraw change request " + changeRequest.getChangeRequestUid());
        }
        require(actorEmail, changeRequest.getDataset(), GateAction.WITHDRAW);
    }

    public void requireRead(String actorEmail, ChangeRequest changeRequest) {
        require(actorEmail, changeRequest.getDataset(), GateAction.READ);
    }

    private String describe(GateAction action) {
        return switch (action) {
            case PROPOSE -> "propose changes";
            case DECIDE -> "decide";
            case WITHDRAW -> "withdraw";
            case READ -> "read";
            case COMMENT -> "comment";
            case MANAGE_DATASET -> "manage the dataset";
        };
    }
}
