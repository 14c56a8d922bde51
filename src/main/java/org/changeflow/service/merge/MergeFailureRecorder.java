package org.changeflow.service.merge;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.changeflow.models.entity.ChangeRequest;
import org.changeflow.models.enums.ChangeRequestEventType;
import org.changeflow.models.enums.ValidationPhase;
import org.changeflow.repository.ChangeRequestRepository;
import org.changeflow.service.lifecycle.ChangeRequestAudit;
import org.changeflow.service.validation.ValidationReport;
import org.changeflow.service.validation.ValidationReports;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the outcome of a failed merge in its own transaction, after the merge transaction rolled back.
 * Status and reviewer decisions are left alone.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MergeFailureRecorder {

    private final ChangeRequestRepository changeRequestRepository;
    private final ValidationReports validationReports;
    private final ChangeRequestAudit audit;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailure(Long changeRequestId, String actorEmail, String message, ValidationReport report) {
        ChangeRequest changeRequest = changeRequestRepository.findByIdForUpdate(changeRequestId).orElse(null);
        if (changeRequest == null || !changeRequest.isPending()) {
            return;
        }
        changeRequest.setMergeAttempts(changeRequest.getMergeAttempts() + 1);
        changeRequest.setLastMergeError(message);
        changeRequest.setUpdatedAt(Instant.now());
        if (report != null) {
            changeRequest.setValidationState(report.state());
            changeRequest.setValidationReport(validationReports.toDocument(report, ValidationPhase.COMMIT));
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("attempt", changeRequest.getMergeAttempts());
        if (report != null) {
            metadata.put("validation", report.state().name());
        }
        audit.record(changeRequest, ChangeRequestEventType.MERGE_FAILED, actorEmail, message, metadata);
        log.error("Merge of change request {} failed (attempt {}): {}", changeRequest.getChangeRequestUid(),
                changeRequest.getMergeAttempts(), message);
    }
}
