package org.changeflow.service;

import lombok.RequiredArgsConstructor;
import org.changeflow.models.dto.ChangeCommentDTO;
import org.changeflow.models.dto.ChangeRequestDTO;
import org.changeflow.models.dto.ChangeRequestEventDTO;
import org.changeflow.models.dto.ReviewerDecisionDTO;
import org.changeflow.models.entity.ChangeComment;
import org.changeflow.models.entity.ChangeRequest;
import org.changeflow.models.entity.ChangeRequestEvent;
import org.changeflow.models.enums.MergeState;
import org.changeflow.service.validation.ValidationReports;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
@RequiredArgsConstructor
public class ChangeRequestMapper {

    private final ValidationReports validationReports;

    public ChangeRequestDTO toDto(ChangeRequest changeRequest) {
        List<ReviewerDecisionDTO> reviewers = changeRequest.getDecisions().stream()
                .map(decision -> new ReviewerDecisionDTO(
                        decision.getReviewer().getEmail(),
                        decision.getReviewer().getName(),
                        decision.getDecision().name().toLowerCase(Locale.ROOT),
                        decision.getDecidedAt(),
                        decision.getComment(),
                        Boolean.TRUE.equals(decision.getWarningsAcknowledged())))
                .toList();
        return new ChangeRequestDTO(
                changeRequest.getChangeRequestUid(),
                changeRequest.getDataset().getId(),
                changeRequest.getDataset().getName(),
                changeRequest.getRequester().getEmail(),
                changeRequest.getTitle(),
                changeRequest.getDescription(),
                changeRequest.getStatus().wireName(),
                mergeState(changeRequest).name().toLowerCase(Locale.ROOT),
                reviewers,
                changeRequest.getStagedRowCount(),
                changeRequest.getSourceFilename(),
                changeRequest.getSourceBytes(),
                changeRequest.getSourceChecksum(),
                changeRequest.getMergeAttempts(),
                changeRequest.getLastMergeError(),
                changeRequest.getQuorumReachedAt(),
                changeRequest.getMergedAt(),
                changeRequest.getClosedAt(),
                changeRequest.getCreatedAt(),
                changeRequest.getUpdatedAt(),
                validationReports.fromDocument(changeRequest.getValidationReport())
        );
    }

    public ChangeCommentDTO toDto(ChangeComment comment) {
        return new ChangeCommentDTO(comment.getId(), comment.getAuthor().getEmail(), comment.getAuthor().getName(),
                comment.getBody(), comment.getCreatedAt());
    }

    public ChangeRequestEventDTO toDto(ChangeRequestEvent event) {
        return new ChangeRequestEventDTO(event.getId(), event.getEventType().name().toLowerCase(Locale.ROOT),
                event.getActorEmail(), event.getMessage(), event.getMetadata(), event.getCreatedAt());
    }

    public static MergeState mergeState(ChangeRequest changeRequest) {
        return switch (changeRequest.getStatus()) {
            case APPROVED -> MergeState.MERGED;
            case REJECTED, WITHDRAWN -> MergeState.DISCARDED;
            case PENDING -> {
                if (changeRequest.getQuorumReachedAt() == null) {
                    yield MergeState.NOT_READY;
                }
                yield changeRequest.getLastMergeError() != null ? MergeState.FAILED : MergeState.READY;
            }
        };
    }
}
