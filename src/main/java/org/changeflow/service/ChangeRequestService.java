package org.changeflow.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.changeflow.configuration.ChangeflowProperties;
import org.changeflow.exceptions.ChangeRequestException;
import org.changeflow.exceptions.MergeAbortedException;
import org.changeflow.exceptions.StoreUnavailableException;
import org.changeflow.models.dto.ChangeCommentDTO;
import org.changeflow.models.dto.ChangeRequestDTO;
import org.changeflow.models.dto.ChangeRequestEventDTO;
import org.changeflow.models.dto.ChangeRequestPreviewDTO;
import org.changeflow.models.dto.DecisionRequest;
import org.changeflow.models.dto.OpenChangeRequestRequest;
import org.changeflow.models.entity.ChangeRequest;
import org.changeflow.models.enums.DecisionStatus;
import org.changeflow.models.enums.QuorumVerdict;
import org.changeflow.service.lifecycle.ChangeRequestStateMachine;
import org.changeflow.service.lifecycle.ChangeRequestStateMachine.DecisionOutcome;
import org.changeflow.service.lifecycle.ChangeRequestStateMachine.OpenCommand;
import org.changeflow.service.merge.MergeCommitEngine;
import org.changeflow.service.merge.MergeFailureRecorder;
import org.changeflow.service.merge.MergeResult;
import org.changeflow.service.validation.ValidationReport;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Entry point for change-request operations. Holds no transaction of its own: each step below runs in
 * the transaction of the component it calls, so a failed merge never rolls back the decision that
 * triggered it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChangeRequestService {

    private final ChangeRequestStateMachine stateMachine;
    private final MergeCommitEngine mergeCommitEngine;
    private final MergeFailureRecorder mergeFailureRecorder;
    private final ChangeRequestQueryService queryService;
    private final ChangeRequestCommentService commentService;
    private final ChangeflowProperties properties;

    public ChangeRequestDTO open(OpenChangeRequestRequest request, String actorEmail) {
        OpenCommand command = new OpenCommand(
                request.datasetId(),
                request.reviewers(),
                request.title(),
                request.description(),
                request.rows(),
                request.filename(),
                request.byteLength(),
                request.checksum(),
                request.comment()
        );
        ChangeRequest opened = guard(() -> stateMachine.open(command, actorEmail));
        return queryService.get(opened.getChangeRequestUid(), actorEmail);
    }

    public ChangeRequestDTO decide(String changeRequestUid, DecisionRequest request, String actorEmail) {
        DecisionStatus decision = parseDecision(request.decision());
        DecisionOutcome outcome = withDecisionRetry(() -> stateMachine.recordDecision(
                changeRequestUid, actorEmail, decision, request.comment(), request.acknowledgeWarnings()));
        if (outcome.verdict() == QuorumVerdict.APPROVED) {
            merge(outcome.changeRequestId(), actorEmail);
        }
        return queryService.get(changeRequestUid, actorEmail);
    }

    public ChangeRequestDTO withdraw(String changeRequestUid, String actorEmail) {
        guard(() -> stateMachine.withdraw(changeRequestUid, actorEmail));
        return queryService.get(changeRequestUid, actorEmail);
    }

    /**
     * Runs the merge again for a request every reviewer already approved.
     */
    public ChangeRequestDTO retryMerge(String changeRequestUid, String actorEmail) {
        Long changeRequestId = guard(() -> stateMachine.prepareRetry(changeRequestUid, actorEmail));
        merge(changeRequestId, actorEmail);
        return queryService.get(changeRequestUid, actorEmail);
    }

    public ChangeRequestDTO get(String changeRequestUid, String actorEmail) {
        return queryService.get(changeRequestUid, actorEmail);
    }

    public List<ChangeRequestDTO> list(Long datasetId, String status, String actorEmail) {
        return queryService.list(datasetId, status, actorEmail);
    }

    public ValidationReport validationReport(String changeRequestUid, String actorEmail) {
        return queryService.validationReport(changeRequestUid, actorEmail);
    }

    public ChangeRequestPreviewDTO preview(String changeRequestUid, int limit, String actorEmail) {
        return queryService.preview(changeRequestUid, limit, actorEmail);
    }

    public List<ChangeCommentDTO> comments(String changeRequestUid, String actorEmail) {
        return queryService.comments(changeRequestUid, actorEmail);
    }

    public ChangeCommentDTO addComment(String changeRequestUid, String body, String actorEmail) {
        return commentService.addComment(changeRequestUid, body, actorEmail);
    }

    public List<ChangeRequestEventDTO> events(String changeRequestUid, String actorEmail) {
        return queryService.events(changeRequestUid, actorEmail);
    }

    private MergeResult merge(Long changeRequestId, String actorEmail) {
        try {
            return mergeCommitEngine.commit(changeRequestId, actorEmail);
        } catch (MergeAbortedException e) {
            recordFailure(changeRequestId, actorEmail, e.getReason(), e.getReport(), e);
            throw e;
        } catch (ResponseStatusException e) {
            throw e;
        } catch (DataAccessException e) {
            ChangeRequestException translated = translate(e);
            recordFailure(changeRequestId, actorEmail, translated.getReason(), null, translated);
            throw translated;
        } catch (RuntimeException e) {
            MergeAbortedException aborted = new MergeAbortedException("Merge could not complete: " + e.getMessage(), null, e);
            recordFailure(changeRequestId, actorEmail, aborted.getReason(), null, aborted);
            throw aborted;
        }
    }

    private void recordFailure(Long changeRequestId, String actorEmail, String message, ValidationReport report,
                               RuntimeException failure) {
        try {
            mergeFailureRecorder.markFailure(changeRequestId, actorEmail, message, report);
        } catch (RuntimeException recordError) {
            log.error("Could not record merge failure of change request {}", changeRequestId, recordError);
            failure.addSuppressed(recordError);
        }
    }

    private <T> T withDecisionRetry(Supplier<T> action) {
        int maxAttempts = Math.max(1, properties.getDecision().getMaxAttempts());
        for (int attempt = 1; ; attempt++) {
            try {
                return guard(action);
            } catch (ConcurrencyFailureException e) {
                if (attempt >= maxAttempts) {
                    throw new StoreUnavailableException("Decision could not be serialized after " + attempt + " attempts", e);
                }
                log.warn("Concurrent decision conflict, retrying (attempt {} of {}): {}", attempt, maxAttempts, e.getMessage());
            }
        }
    }

    private <T> T guard(Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessResourceException e) {
            throw translate(e);
        }
    }

    private ChangeRequestException translate(DataAccessException e) {
        if (e instanceof DataAccessResourceFailureException || e instanceof TransientDataAccessResourceException) {
            log.error("Store unavailable: {}", e.getMessage());
            return new StoreUnavailableException("Storage is unavailable, retry later", e);
        }
        return new MergeAbortedException("Merge could not complete: " + e.getMostSpecificCause().getMessage(), null, e);
    }

    private DecisionStatus parseDecision(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "approve", "approved" -> DecisionStatus.APPROVED;
            case "reject", "rejected" -> DecisionStatus.REJECTED;
            default -> throw new IllegalArgumentException("Decision must be approve or reject");
        };
    }
}
