package org.changeflow.service.lifecycle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.changeflow.configuration.ChangeflowProperties;
import org.changeflow.exceptions.ForbiddenException;
import org.changeflow.exceptions.MergeAbortedException;
import org.changeflow.exceptions.NotPendingException;
import org.changeflow.exceptions.ValidationFailedException;
import org.changeflow.models.entity.ApplicationUser;
import org.changeflow.models.entity.ChangeRequest;
import org.changeflow.models.entity.Dataset;
import org.changeflow.models.entity.ReviewerDecision;
import org.changeflow.models.enums.ChangeRequestEventType;
import org.changeflow.models.enums.ChangeRequestStatus;
import org.changeflow.models.enums.DecisionStatus;
import org.changeflow.models.enums.GateAction;
import org.changeflow.models.enums.QuorumVerdict;
import org.changeflow.models.enums.ValidationPhase;
import org.changeflow.models.enums.ValidationState;
import org.changeflow.repository.ChangeRequestRepository;
import org.changeflow.repository.DatasetRepository;
import org.changeflow.service.DatasetMetaService;
import org.changeflow.service.UserService;
import org.changeflow.service.access.ProjectAccessService;
import org.changeflow.service.review.ReviewerQuorumTracker;
import org.changeflow.service.staging.StagingStore;
import org.changeflow.service.validation.RuleEvaluator;
import org.changeflow.service.validation.SeverityAggregator;
import org.changeflow.service.validation.ValidationReport;
import org.changeflow.service.validation.ValidationReports;
import org.changeflow.utils.AppUtils;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Transitions of a change request: {@code PENDING -> APPROVED | REJECTED | WITHDRAWN}. Every mutating method
 * runs in its own transaction and takes a row lock on the change request before reading its state, so
 * concurrent callers observe each other's decisions in a serial order.
 * <p>
 * The transition to {@code APPROVED} belongs to {@link org.changeflow.service.merge.MergeCommitEngine}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChangeRequestStateMachine {

    private static final String DEFAULT_TITLE = "Append data";

    private final ChangeRequestRepository changeRequestRepository;
    private final DatasetRepository datasetRepository;
    private final ProjectAccessService projectAccessService;
    private final UserService userService;
    private final RuleEvaluator ruleEvaluator;
    private final SeverityAggregator severityAggregator;
    private final ValidationReports validationReports;
    private final ReviewerQuorumTracker quorumTracker;
    private final StagingStore stagingStore;
    private final DatasetMetaService datasetMetaService;
    private final ChangeRequestAudit audit;
    private final ChangeflowProperties properties;
    private final ObjectMapper objectMapper;

    @Transactional
    public ChangeRequest open(OpenCommand command, String actorEmail) {
        Dataset dataset = datasetRepository.findById(command.datasetId())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Dataset not found"));
        projectAccessService.require(actorEmail, dataset, GateAction.PROPOSE);

        List<String> reviewers = normalizeReviewers(command.reviewers());
        for (String reviewer : reviewers) {
            if (!projectAccessService.isMember(reviewer, dataset.getProject().getId())) {
                throw new IllegalArgumentException("Reviewer " + reviewer + " is not a member of the project");
            }
        }

        List<Map<String, Object>> rows = command.rows() == null ? List.of() : command.rows();
        int sampleSize = Math.max(1, properties.getValidation().getSampleSize());
        List<Map<String, Object>> sample = rows.size() > sampleSize ? rows.subList(0, sampleSize) : rows;
        ValidationReport report = severityAggregator.aggregate(
                ruleEvaluator.evaluate(dataset.getSchemaDefinition(), dataset.getRules(), sample));
        if (report.isFailed()) {
            log.warn("Proposal on dataset {} by {} rejected by validation: {}", dataset.getId(), actorEmail, report.counts());
            throw new ValidationFailedException("Proposed rows failed validation", report);
        }

        ApplicationUser requester = userService.resolve(actorEmail);
        Instant now = Instant.now();
        ChangeRequest changeRequest = new ChangeRequest();
        changeRequest.setChangeRequestUid(AppUtils.generateUUID());
        changeRequest.setDataset(dataset);
        changeRequest.setRequester(requester);
        changeRequest.setTitle(StringUtils.hasText(command.title()) ? command.title().trim() : DEFAULT_TITLE);
        changeRequest.setDescription(command.description());
        changeRequest.setStatus(ChangeRequestStatus.PENDING);
        changeRequest.setValidationState(report.state());
        changeRequest.setValidationReport(validationReports.toDocument(report, ValidationPhase.PROPOSAL));
        changeRequest.setMergeAttempts(0);
        changeRequest.setStagedRowCount(rows.size());
        changeRequest.setCreatedAt(now);
        changeRequest.setUpdatedAt(now);
        applySourceMetadata(changeRequest, command, rows);

        int position = 0;
        for (String reviewerEmail : reviewers) {
            ReviewerDecision decision = new ReviewerDecision();
            decision.setChangeRequest(changeRequest);
            decision.setReviewer(userService.resolve(reviewerEmail));
            decision.setPosition(position++);
            decision.setDecision(DecisionStatus.PENDING);
            decision.setWarningsAcknowledged(false);
            changeRequest.getDecisions().add(decision);
        }
        changeRequestRepository.saveAndFlush(changeRequest);

        audit.record(changeRequest, ChangeRequestEventType.CREATED, actorEmail, "Change request opened",
                Map.of("reviewers", reviewers, "rows", rows.size(), "validation", report.state().name()));
        if (StringUtils.hasText(command.comment())) {
            audit.comment(changeRequest, requester, command.comment());
        }
        datasetMetaService.refreshPending(dataset);
        changeRequestRepository.flush();

        changeRequest.setStagingLocation(stagingStore.materialize(changeRequest, rows).qualified());
        log.info("Opened change request {} on dataset {} by {} with {} rows, validation {}",
                changeRequest.getChangeRequestUid(), dataset.getId(), actorEmail, rows.size(), report.state());
        return changeRequest;
    }

    /**
     * Records one reviewer decision. A rejecting verdict closes the request here; an approving verdict only
     * marks quorum, the caller then runs the merge in a separate transaction.
     */
    @Transactional
    public DecisionOutcome recordDecision(String changeRequestUid,
                                          String actorEmail,
                                          DecisionStatus decision,
                                          String comment,
                                          boolean acknowledgeWarnings) {
        ChangeRequest changeRequest = lockRequired(changeRequestUid);
        projectAccessService.requireDecide(actorEmail, changeRequest);
        if (!changeRequest.isPending()) {
            throw new NotPendingException(changeRequestUid, changeRequest.getStatus());
        }
        QuorumVerdict verdict = quorumTracker.recordDecision(changeRequest, actorEmail, decision, comment,
                decision == DecisionStatus.APPROVED && acknowledgeWarnings);
        if (decision == DecisionStatus.APPROVED && changeRequest.getValidationState() == ValidationState.PARTIAL_PASS) {
            requireWarningAcknowledgement(changeRequest, actorEmail, acknowledgeWarnings);
        }

        Instant now = Instant.now();
        changeRequest.setUpdatedAt(now);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("decision", decision.name());
        metadata.put("verdict", verdict.name());
        if (StringUtils.hasText(comment)) {
            metadata.put("comment", comment);
        }
        audit.record(changeRequest, ChangeRequestEventType.DECISION_RECORDED, actorEmail,
                actorEmail + " " + decision.name().toLowerCase(Locale.ROOT) + " the change request", metadata);

        switch (verdict) {
            case REJECTED -> {
                close(changeRequest, ChangeRequestStatus.REJECTED, now);
                audit.record(changeRequest, ChangeRequestEventType.REJECTED, actorEmail, "Change request rejected", null);
                datasetMetaService.refreshPending(changeRequest.getDataset());
                changeRequestRepository.flush();
                stagingStore.discard(changeRequest);
                log.info("Change request {} rejected by {}", changeRequestUid, actorEmail);
            }
            case APPROVED -> {
                if (changeRequest.getQuorumReachedAt() == null) {
                    changeRequest.setQuorumReachedAt(now);
                }
                changeRequestRepository.flush();
                log.info("Change request {} reached quorum with the decision of {}", changeRequestUid, actorEmail);
            }
            case PENDING -> {
                changeRequestRepository.flush();
                log.info("Change request {}: {} recorded {}, waiting for remaining reviewers",
                        changeRequestUid, actorEmail, decision);
            }
        }
        return new DecisionOutcome(changeRequest.getId(), verdict);
    }

    @Transactional
    public ChangeRequest withdraw(String changeRequestUid, String actorEmail) {
        ChangeRequest changeRequest = lockRequired(changeRequestUid);
        projectAccessService.requireWithdraw(actorEmail, changeRequest);
        if (!changeRequest.isPending()) {
            throw new NotPendingException(changeRequestUid, changeRequest.getStatus());
        }
        close(changeRequest, ChangeRequestStatus.WITHDRAWN, Instant.now());
        audit.record(changeRequest, ChangeRequestEventType.WITHDRAWN, actorEmail, "Change request withdrawn", null);
        datasetMetaService.refreshPending(changeRequest.getDataset());
        changeRequestRepository.flush();
        stagingStore.discard(changeRequest);
        log.info("Change request {} withdrawn by {}", changeRequestUid, actorEmail);
        return changeRequest;
    }

    /**
     * Checks that a merge may be attempted again for a request whose reviewers already approved it.
     */
    @Transactional(readOnly = true)
    public Long prepareRetry(String changeRequestUid, String actorEmail) {
        ChangeRequest changeRequest = changeRequestRepository.findByChangeRequestUid(changeRequestUid)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Change request not found"));
        projectAccessService.requireDecide(actorEmail, changeRequest);
        if (!changeRequest.isPending()) {
            throw new NotPendingException(changeRequestUid, changeRequest.getStatus());
        }
        if (quorumTracker.verdictOf(changeRequest.getDecisions()) != QuorumVerdict.APPROVED) {
            throw new MergeAbortedException("Change request " + changeRequestUid + " has not been approved by every reviewer");
        }
        return changeRequest.getId();
    }

    private void requireWarningAcknowledgement(ChangeRequest changeRequest, String actorEmail, boolean acknowledgeWarnings) {
        if (changeRequest.isRequestedBy(actorEmail) && acknowledgeWarnings) {
            throw new ForbiddenException("The requester cannot acknowledge validation warnings on their own change request");
        }
        if (!acknowledgeWarnings && !changeRequest.hasWarningsAcknowledged()) {
            throw new ValidationFailedException("Approval requires acknowledging the validation warnings",
                    validationReports.fromDocument(changeRequest.getValidationReport()));
        }
    }

    private void close(ChangeRequest changeRequest, ChangeRequestStatus status, Instant at) {
        changeRequest.setStatus(status);
        changeRequest.setClosedAt(at);
        changeRequest.setUpdatedAt(at);
    }

    private ChangeRequest lockRequired(String changeRequestUid) {
        return changeRequestRepository.findByUidForUpdate(changeRequestUid)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Change request not found"));
    }

    private List<String> normalizeReviewers(List<String> reviewers) {
        Set<String> unique = new LinkedHashSet<>();
        if (reviewers != null) {
            for (String reviewer : reviewers) {
                if (StringUtils.hasText(reviewer)) {
                    unique.add(reviewer.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        if (unique.isEmpty()) {
            throw new IllegalArgumentException("At least one reviewer is required");
        }
        return new ArrayList<>(unique);
    }

    private void applySourceMetadata(ChangeRequest changeRequest, OpenCommand command, List<Map<String, Object>> rows) {
        changeRequest.setSourceFilename(command.filename());
        if (StringUtils.hasText(command.checksum()) && command.byteLength() != null) {
            changeRequest.setSourceChecksum(command.checksum().trim().toLowerCase(Locale.ROOT));
            changeRequest.setSourceBytes(command.byteLength());
            return;
        }
        byte[] canonical;
        try {
            canonical = objectMapper.writeValueAsString(rows).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Rows are not serializable to JSON", e);
        }
        changeRequest.setSourceChecksum(StringUtils.hasText(command.checksum())
                ? command.checksum().trim().toLowerCase(Locale.ROOT)
                : AppUtils.sha256Hex(canonical));
        changeRequest.setSourceBytes(command.byteLength() != null ? command.byteLength() : (long) canonical.length);
    }

    public record OpenCommand(Long datasetId,
                              List<String> reviewers,
                              String title,
                              String description,
                              List<Map<String, Object>> rows,
                              String filename,
                              Long byteLength,
                              String checksum,
                              String comment) {
    }

    public record DecisionOutcome(Long changeRequestId, QuorumVerdict verdict) {
    }
}
