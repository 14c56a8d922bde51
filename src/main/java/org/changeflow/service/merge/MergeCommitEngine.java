package org.changeflow.service.merge;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.changeflow.adapters.RowStore;
import org.changeflow.adapters.TableNamespace;
import org.changeflow.adapters.TableRef;
import org.changeflow.exceptions.MergeAbortedException;
import org.changeflow.exceptions.NotPendingException;
import org.changeflow.models.entity.ChangeRequest;
import org.changeflow.models.entity.Dataset;
import org.changeflow.models.entity.DatasetMeta;
import org.changeflow.models.entity.DatasetVersion;
import org.changeflow.models.enums.ChangeRequestEventType;
import org.changeflow.models.enums.ChangeRequestStatus;
import org.changeflow.models.enums.DecisionStatus;
import org.changeflow.models.enums.QuorumVerdict;
import org.changeflow.models.enums.ValidationPhase;
import org.changeflow.repository.ChangeRequestRepository;
import org.changeflow.repository.DatasetRepository;
import org.changeflow.repository.DatasetVersionRepository;
import org.changeflow.service.DatasetMetaService;
import org.changeflow.service.lifecycle.ChangeRequestAudit;
import org.changeflow.service.review.ReviewerQuorumTracker;
import org.changeflow.service.staging.StagingStore;
import org.changeflow.service.validation.RuleEvaluator;
import org.changeflow.service.validation.SeverityAggregator;
import org.changeflow.service.validation.ValidationReport;
import org.changeflow.service.validation.ValidationReports;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Moves the staged rows of an approved change request into its dataset's canonical table.
 * <p>
 * One transaction covers re-validation, the append, the metadata refresh and the status change. The change
 * request row and then the dataset row are locked first, so a request merges at most once and merges into
 * the same dataset run one after another. If anything throws before the staging table is dropped, the
 * transaction rolls back and the canonical table, its metadata and the staging table are as they were. The
 * drop is the last statement, issued after every row write has been flushed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MergeCommitEngine {

    private final ChangeRequestRepository changeRequestRepository;
    private final DatasetRepository datasetRepository;
    private final DatasetVersionRepository datasetVersionRepository;
    private final RowStore rowStore;
    private final TableNamespace tableNamespace;
    private final StagingStore stagingStore;
    private final RuleEvaluator ruleEvaluator;
    private final SeverityAggregator severityAggregator;
    private final ValidationReports validationReports;
    private final ReviewerQuorumTracker quorumTracker;
    private final DatasetMetaService datasetMetaService;
    private final ChangeRequestAudit audit;

    @Transactional
    public MergeResult commit(Long changeRequestId, String actorEmail) {
        Long datasetId = changeRequestRepository.findDatasetIdById(changeRequestId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Change request not found"));
        TableRef canonical = tableNamespace.canonical(datasetId);
        // before any lock: DDL ends the running transaction on some databases
        rowStore.createTableIfMissing(canonical);

        ChangeRequest changeRequest = changeRequestRepository.findByIdForUpdate(changeRequestId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Change request not found"));
        String uid = changeRequest.getChangeRequestUid();
        if (changeRequest.getStatus() == ChangeRequestStatus.APPROVED) {
            log.info("Change request {} already merged, nothing to do", uid);
            return new MergeResult(changeRequestId, 0L, rowStore.countRows(canonical), true);
        }
        if (!changeRequest.isPending()) {
            throw new NotPendingException(uid, changeRequest.getStatus());
        }
        if (quorumTracker.verdictOf(changeRequest.getDecisions()) != QuorumVerdict.APPROVED) {
            throw new MergeAbortedException("Change request " + uid + " has not been approved by every reviewer");
        }
        Dataset dataset = datasetRepository.findByIdForUpdate(datasetId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Dataset not found"));

        if (!stagingStore.exists(changeRequest)) {
            throw new MergeAbortedException("Staging area of change request " + uid + " is missing");
        }
        List<Map<String, Object>> staged = stagingStore.rows(changeRequest);
        ValidationReport report = severityAggregator.aggregate(
                ruleEvaluator.evaluate(dataset.getSchemaDefinition(), dataset.getRules(), staged));
        if (report.isFailed()) {
            log.warn("Change request {} failed validation at commit: {}", uid, report.counts());
            throw new MergeAbortedException("Staged rows no longer pass the dataset's validation", report, null);
        }
        if (report.isPartialPass() && !changeRequest.hasWarningsAcknowledged()) {
            throw new MergeAbortedException(
                    "Validation warnings must be acknowledged by an approving reviewer other than the requester", report, null);
        }

        TableRef staging = stagingStore.locationOf(changeRequest);
        long before = rowStore.countRows(canonical);
        long appended = rowStore.appendFrom(staging, canonical);
        if (appended != staged.size()) {
            throw new MergeAbortedException("Appended " + appended + " rows but " + staged.size() + " were staged");
        }

        Instant now = Instant.now();
        changeRequest.setStatus(ChangeRequestStatus.APPROVED);
        changeRequest.setValidationState(report.state());
        changeRequest.setValidationReport(validationReports.toDocument(report, ValidationPhase.COMMIT));
        changeRequest.setMergeAttempts(changeRequest.getMergeAttempts() + 1);
        changeRequest.setLastMergeError(null);
        changeRequest.setMergedAt(now);
        changeRequest.setClosedAt(now);
        changeRequest.setUpdatedAt(now);
        dataset.setTableLocation(canonical.qualified());
        dataset.setUpdatedAt(now);

        DatasetMeta meta = datasetMetaService.recompute(dataset);
        List<String> approvers = changeRequest.getDecisions().stream()
                .filter(decision -> decision.getDecision() == DecisionStatus.APPROVED)
                .map(decision -> decision.getReviewer().getEmail())
                .toList();
        DatasetVersion version = new DatasetVersion();
        version.setDataset(dataset);
        version.setChangeRequest(changeRequest);
        version.setTableLocation(canonical.qualified());
        version.setRowCount(meta.getRowCount());
        version.setRowsAppended(appended);
        version.setApprovers(approvers);
        version.setAppliedBy(actorEmail);
        version.setAppliedAt(now);
        datasetVersionRepository.save(version);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("rowsAppended", appended);
        metadata.put("rowCountBefore", before);
        metadata.put("rowCountAfter", meta.getRowCount());
        metadata.put("approvers", approvers);
        audit.record(changeRequest, ChangeRequestEventType.MERGED, actorEmail,
                "Appended " + appended + " rows to " + canonical.qualified(), metadata);
        audit.record(changeRequest, ChangeRequestEventType.APPROVED, actorEmail, "Change request approved", null);
        changeRequestRepository.flush();

        stagingStore.discard(changeRequest);
        log.info("Merged change request {} into {}: {} rows appended, {} total", uid, canonical, appended, meta.getRowCount());
        return new MergeResult(changeRequestId, appended, meta.getRowCount(), false);
    }
}
