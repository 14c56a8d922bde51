package org.changeflow.service;

import lombok.RequiredArgsConstructor;
import org.changeflow.models.dto.ChangeCommentDTO;
import org.changeflow.models.entity.ChangeComment;
import org.changeflow.models.entity.ChangeRequest;
import org.changeflow.models.enums.ChangeRequestEventType;
import org.changeflow.models.enums.GateAction;
import org.changeflow.repository.ChangeRequestRepository;
import org.changeflow.service.access.ProjectAccessService;
import org.changeflow.service.lifecycle.ChangeRequestAudit;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

@Service
@RequiredArgsConstructor
public class ChangeRequestCommentService {

    private final ChangeRequestRepository changeRequestRepository;
    private final ProjectAccessService projectAccessService;
    private final UserService userService;
    private final ChangeRequestAudit audit;
    private final ChangeRequestMapper mapper;

    @Transactional
    public ChangeCommentDTO addComment(String changeRequestUid, String body, String actorEmail) {
        if (!StringUtils.hasText(body)) {
            throw new IllegalArgumentException("Comment body is required");
        }
        ChangeRequest changeRequest = changeRequestRepository.findByChangeRequestUid(changeRequestUid)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Change request not found"));
        projectAccessService.require(actorEmail, changeRequest.getDataset(), GateAction.COMMENT);
        ChangeComment comment = audit.comment(changeRequest, userService.resolve(actorEmail), body);
        audit.record(changeRequest, ChangeRequestEventType.COMMENTED, actorEmail, null, Map.of("commentId", comment.getId()));
        return mapper.toDto(comment);
    }
}
