package org.changeflow.service.lifecycle;

import org.changeflow.exceptions.ForbiddenException;
import org.changeflow.exceptions.MergeAbortedException;
import org.changeflow.exceptions.NotAssignedException;
import org.changeflow.exceptions.NotPendingException;
import org.changeflow.exceptions.ValidationFailedException;
import org.changeflow.models.dto.ChangeCommentDTO;
import org.changeflow.models.dto.ChangeRequestDTO;
import org.changeflow.models.dto.ChangeRequestEventDTO;
import org.changeflow.models.dto.ChangeRequestPreviewDTO;
import org.changeflow.models.dto.DatasetMetaDTO;
import org.changeflow.models.dto.DecisionRequest;
import org.changeflow.models.dto.OpenChangeRequestRequest;
import org.changeflow.models.dto.UpdateDatasetRulesRequest;
import org.changeflow.models.enums.ValidationState;
import org.changeflow.service.validation.ValidationReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Change request lifecycle Tests")
class ChangeRequestLifecycleTest extends LifecycleTestSupport {

    @Test
    @DisplayName("Single reviewer approval merges the staged row and drops staging")
    void testApproveSingleReviewer() {
        Long datasetId = newDataset();
        ChangeRequestDTO opened = open(datasetId, List.of(BOB), List.of(Map.of("id", 1, "name", "first")));
        assertEquals("pending", opened.status());
        assertEquals(ValidationState.PASSED, opened.validation().state());
        assertEquals("not_ready", opened.mergeState());
        assertTrue(stagingExists(datasetId, opened.id()));
        assertEquals(0, canonicalCount(datasetId));

        ChangeRequestDTO approved = approve(opened.id(), BOB);

        assertEquals("approved", approved.status());
        assertEquals("merged", approved.mergeState());
        assertEquals(1, approved.mergeAttempts());
        assertNotNull(approved.mergedAt());
        assertEquals(1, canonicalCount(datasetId));
        assertFalse(stagingExists(datasetId, opened.id()));
        assertEquals(1, datasetVersionRepository.findAllByDataset_IdOrderByIdDesc(datasetId).size());

        DatasetMetaDTO meta = datasetService.meta(datasetId, OWNER);
        assertEquals(1, meta.rowCount());
        assertEquals(0, meta.pendingApprovals());
    }

    @ParameterizedTest
    @ValueSource(booleans = {true, false})
    @DisplayName("One approval and one rejection end rejected in either order")
    void testApproveAndReject(boolean approveFirst) {
        Long datasetId = newDataset();
        ChangeRequestDTO opened = open(datasetId, List.of(BOB, CAROL), rows(2));

        ChangeRequestDTO result;
        if (approveFirst) {
            assertEquals("pending", approve(opened.id(), BOB).status());
            result = reject(opened.id(), CAROL);
        } else {
            result = reject(opened.id(), CAROL);
            assertThrows(NotPendingException.class, () -> approve(opened.id(), BOB));
        }

        assertEquals("rejected", result.status());
        assertEquals("discarded", result.mergeState());
        assertEquals("rejected", changeRequestService.get(opened.id(), REQUESTER).status());
        assertEquals(0, canonicalCount(datasetId));
        assertFalse(stagingExists(datasetId, opened.id()));
    }

    @Test
    @DisplayName("A fatal finding blocks the proposal and leaves nothing behind")
    void testFatalValidation() {
        Long datasetId = newDataset(null, List.of(Map.of("type", "greater_than", "column", "id", "value", "not-a-number")));

        ValidationFailedException ex = assertThrows(ValidationFailedException.class,
                () -> open(datasetId, List.of(BOB), rows(1)));

        assertEquals("validation_failed", ex.getErrorCode());
        assertEquals(ValidationState.FAILED, ex.getReport().state());
        assertEquals(1, ex.getReport().counts().fatal());
        assertTrue(changeRequestRepository.findAllByDataset_IdOrderByCreatedAtDesc(datasetId).isEmpty());
        assertEquals(0, stagingTableCount(datasetId));
    }

    @Test
    @DisplayName("Withdrawn requests accept no further withdraw or decision")
    void testWithdraw() {
        Long datasetId = newDataset();
        ChangeRequestDTO opened = open(datasetId, List.of(BOB), rows(1));

        ChangeRequestDTO withdrawn = changeRequestService.withdraw(opened.id(), REQUESTER);

        assertEquals("withdrawn", withdrawn.status());
        assertNotNull(withdrawn.closedAt());
        assertFalse(stagingExists(datasetId, opened.id()));
        NotPendingException again = assertThrows(NotPendingException.class,
                () -> changeRequestService.withdraw(opened.id(), REQUESTER));
        assertEquals("not_pending", again.getErrorCode());
        assertThrows(NotPendingException.class, () -> approve(opened.id(), BOB));
        assertThrows(NotPendingException.class, () -> reject(opened.id(), BOB));
        assertEquals("withdrawn", changeRequestService.get(opened.id(), REQUESTER).status());
    }

    @Test
    @DisplayName("Approved requests stay approved")
    void testTerminalApproved() {
        Long datasetId = newDataset();
        ChangeRequestDTO opened = open(datasetId, List.of(BOB), rows(3));
        approve(opened.id(), BOB);

        assertThrows(NotPendingException.class, () -> reject(opened.id(), BOB));
        assertThrows(NotPendingException.class, () -> changeRequestService.withdraw(opened.id(), REQUESTER));
        assertThrows(NotPendingException.class, () -> changeRequestService.retryMerge(opened.id(), BOB));
        assertEquals("approved", changeRequestService.get(opened.id(), REQUESTER).status());
        assertEquals(3, canonicalCount(datasetId));
    }

    @Test
    @DisplayName("Approval waits for every assigned reviewer")
    void testQuorumOfThree() {
        Long datasetId = newDataset();
        ChangeRequestDTO opened = open(datasetId, List.of(BOB, CAROL, OWNER), rows(2));

        assertEquals("pending", approve(opened.id(), CAROL).status());
        assertEquals("pending", approve(opened.id(), OWNER).status());
        assertEquals(0, canonicalCount(datasetId));
        ChangeRequestDTO approved = approve(opened.id(), BOB);

        assertEquals("approved", approved.status());
        assertEquals(2, canonicalCount(datasetId));
        assertTrue(approved.reviewers().stream().allMatch(r -> r.decision().equals("approved")));
    }

    @Test
    @DisplayName("Access gate turns away callers without the required role")
    void testAccessGate() {
        Long datasetId = newDataset();
        assertThrows(ForbiddenException.class, () -> changeRequestService.open(new OpenChangeRequestRequest(
                datasetId, List.of(BOB), null, null, rows(1), null, null, null, null), VIEWER));
        assertThrows(ForbiddenException.class, () -> changeRequestService.open(new OpenChangeRequestRequest(
                datasetId, List.of(BOB), null, null, rows(1), null, null, null, null), "stranger@example.com"));

        ChangeRequestDTO opened = open(datasetId, List.of(BOB), rows(1));
        assertThrows(ForbiddenException.class, () -> approve(opened.id(), VIEWER));
        NotAssignedException notAssigned = assertThrows(NotAssignedException.class, () -> approve(opened.id(), CAROL));
        assertEquals("not_assigned", notAssigned.getErrorCode());
        assertThrows(ForbiddenException.class, () -> changeRequestService.withdraw(opened.id(), BOB));
        assertThrows(ForbiddenException.class, () -> changeRequestService.get(opened.id(), "stranger@example.com"));
        assertEquals("pending", changeRequestService.get(opened.id(), VIEWER).status());
    }

    @Test
    @DisplayName("Legacy editor role may propose")
    void testEditorAlias() {
        Long datasetId = newDataset();
        ChangeRequestDTO opened = changeRequestService.open(new OpenChangeRequestRequest(
                datasetId, List.of(BOB), null, null, rows(1), null, null, null, null), ERIN);
        assertEquals(ERIN, opened.requester());
        assertEquals("Append data", opened.title());
    }

    @Test
    @DisplayName("Reviewers must be project members and are deduplicated")
    void testReviewerSet() {
        Long datasetId = newDataset();
        assertThrows(IllegalArgumentException.class, () -> open(datasetId, List.of("stranger@example.com"), rows(1)));
        assertThrows(IllegalArgumentException.class, () -> open(datasetId, List.of(" "), rows(1)));

        ChangeRequestDTO opened = open(datasetId, List.of(BOB, "BOB@example.com", CAROL), rows(1));
        assertEquals(2, opened.reviewers().size());
        assertEquals(BOB, opened.reviewers().get(0).reviewer());
        assertEquals(CAROL, opened.reviewers().get(1).reviewer());
    }

    @Test
    @DisplayName("Warnings must be acknowledged by an approving reviewer")
    void testWarningsAcknowledgement() {
        Long datasetId = newDataset(null,
                List.of(Map.of("type", "allowed_values", "column", "name", "values", List.of("known"))));
        ChangeRequestDTO opened = open(datasetId, List.of(BOB), rows(2));
        assertEquals(ValidationState.PARTIAL_PASS, opened.validation().state());
        assertEquals(2, opened.validation().counts().warning());

        ValidationFailedException ex = assertThrows(ValidationFailedException.class, () -> approve(opened.id(), BOB));
        assertEquals(ValidationState.PARTIAL_PASS, ex.getReport().state());
        ChangeRequestDTO unchanged = changeRequestService.get(opened.id(), REQUESTER);
        assertEquals("pending", unchanged.status());
        assertEquals("pending", unchanged.reviewers().get(0).decision());

        ChangeRequestDTO approved = changeRequestService.decide(opened.id(),
                new DecisionRequest("approve", "accepted as is", true), BOB);
        assertEquals("approved", approved.status());
        assertTrue(approved.reviewers().get(0).warningsAcknowledged());
        assertEquals(2, canonicalCount(datasetId));
    }

    @Test
    @DisplayName("Requester cannot acknowledge warnings on their own request")
    void testRequesterAcknowledgement() {
        Long datasetId = newDataset(null,
                List.of(Map.of("type", "allowed_values", "column", "name", "values", List.of("known"))));
        ChangeRequestDTO opened = open(datasetId, List.of(REQUESTER), rows(1));

        assertThrows(ForbiddenException.class, () -> changeRequestService.decide(opened.id(),
                new DecisionRequest("approve", null, true), REQUESTER));
        assertEquals("pending", changeRequestService.get(opened.id(), REQUESTER).status());
    }

    @Test
    @DisplayName("Rules tightened after proposal abort the merge until relaxed again")
    void testCommitRevalidation() {
        Long datasetId = newDataset();
        ChangeRequestDTO opened = open(datasetId, List.of(BOB), rows(3));
        datasetService.updateRules(datasetId, new UpdateDatasetRulesRequest(null,
                List.of(Map.of("type", "greater_than", "column", "id", "value", 100))), OWNER);

        MergeAbortedException aborted = assertThrows(MergeAbortedException.class, () -> approve(opened.id(), BOB));
        assertTrue(aborted.isRetryable());
        assertEquals(ValidationState.FAILED, aborted.getReport().state());

        ChangeRequestDTO failed = changeRequestService.get(opened.id(), REQUESTER);
        assertEquals("pending", failed.status());
        assertEquals("failed", failed.mergeState());
        assertEquals(1, failed.mergeAttempts());
        assertNotNull(failed.lastMergeError());
        assertEquals("approved", failed.reviewers().get(0).decision());
        assertEquals(ValidationState.FAILED, failed.validation().state());
        assertTrue(stagingExists(datasetId, opened.id()));
        assertEquals(0, canonicalCount(datasetId));

        datasetService.updateRules(datasetId, new UpdateDatasetRulesRequest(null, List.of()), OWNER);
        ChangeRequestDTO merged = changeRequestService.retryMerge(opened.id(), BOB);

        assertEquals("approved", merged.status());
        assertEquals(2, merged.mergeAttempts());
        assertNull(merged.lastMergeError());
        assertEquals(3, canonicalCount(datasetId));
    }

    @Test
    @DisplayName("Retrying a merge before quorum is refused")
    void testRetryBeforeQuorum() {
        Long datasetId = newDataset();
        ChangeRequestDTO opened = open(datasetId, List.of(BOB, CAROL), rows(1));
        approve(opened.id(), BOB);
        assertThrows(MergeAbortedException.class, () -> changeRequestService.retryMerge(opened.id(), BOB));
        assertEquals(0, canonicalCount(datasetId));
    }

    @Test
    @DisplayName("Listing defaults to pending and accepts all")
    void testList() {
        Long datasetId = newDataset();
        ChangeRequestDTO first = open(datasetId, List.of(BOB), rows(1));
        ChangeRequestDTO second = open(datasetId, List.of(BOB), rows(1));
        changeRequestService.withdraw(second.id(), REQUESTER);

        List<ChangeRequestDTO> pending = changeRequestService.list(datasetId, null, VIEWER);
        assertEquals(1, pending.size());
        assertEquals(first.id(), pending.get(0).id());
        assertEquals(2, changeRequestService.list(datasetId, "all", VIEWER).size());
        assertEquals(1, changeRequestService.list(datasetId, "Withdrawn", VIEWER).size());
        assertThrows(IllegalArgumentException.class, () -> changeRequestService.list(datasetId, "merged", VIEWER));
        assertTrue(changeRequestService.list(null, "all", REQUESTER).stream().anyMatch(cr -> cr.id().equals(first.id())));
        assertTrue(changeRequestService.list(null, "all", "stranger@example.com").isEmpty());
    }

    @Test
    @DisplayName("Comments and events record the request history in order")
    void testCommentsAndEvents() {
        Long datasetId = newDataset();
        ChangeRequestDTO opened = changeRequestService.open(new OpenChangeRequestRequest(
                datasetId, List.of(BOB), "Q3 rows", "quarterly load", rows(2), "q3.csv", 120L, "ABC123", "please review"),
                REQUESTER);
        assertEquals("abc123", opened.sourceChecksum());
        assertEquals(120L, opened.sourceBytes());

        changeRequestService.addComment(opened.id(), "looks fine", VIEWER);
        approve(opened.id(), BOB);

        List<ChangeCommentDTO> comments = changeRequestService.comments(opened.id(), REQUESTER);
        assertEquals(List.of("please review", "looks fine"), comments.stream().map(ChangeCommentDTO::body).toList());

        List<String> types = changeRequestService.events(opened.id(), REQUESTER).stream()
                .map(ChangeRequestEventDTO::type)
                .toList();
        assertEquals(List.of("created", "commented", "decision_recorded", "merged", "approved"), types);
    }

    @Test
    @DisplayName("Checksum is derived from the rows when the caller sends none")
    void testDerivedChecksum() {
        Long datasetId = newDataset();
        ChangeRequestDTO opened = open(datasetId, List.of(BOB), rows(1));
        assertNotNull(opened.sourceChecksum());
        assertEquals(64, opened.sourceChecksum().length());
        assertTrue(opened.sourceBytes() > 0);
    }

    @Test
    @DisplayName("Validation report is readable after proposal")
    void testValidationReport() {
        Long datasetId = newDataset(Map.of("properties", Map.of("id", Map.of("type", "integer"))), null);
        ChangeRequestDTO opened = open(datasetId, List.of(BOB), rows(2));

        ValidationReport report = changeRequestService.validationReport(opened.id(), VIEWER);
        assertEquals(ValidationState.PARTIAL_PASS, report.state());
        assertEquals(2, report.counts().warning());
        assertEquals("schema_column", report.items().get(0).ruleType());
    }

    @Test
    @DisplayName("Staged rows are previewable while the request is pending")
    void testPreviewStagedRows() {
        Long datasetId = newDataset();
        ChangeRequestDTO opened = open(datasetId, List.of(BOB), rows(3));

        ChangeRequestPreviewDTO preview = changeRequestService.preview(opened.id(), 2, VIEWER);
        assertEquals(opened.id(), preview.changeRequestId());
        assertEquals(datasetId, preview.datasetId());
        assertEquals(2, preview.rows().size());
        assertEquals(3, preview.stagedRows());
        assertTrue(preview.columns().containsAll(List.of("id", "name")));
        assertEquals(1, changeRequestService.preview(opened.id(), 0, VIEWER).rows().size());
        assertEquals(0, canonicalCount(datasetId));

        assertThrows(ForbiddenException.class,
                () -> changeRequestService.preview(opened.id(), 10, "stranger@example.com"));

        approve(opened.id(), BOB);
        NotPendingException ex = assertThrows(NotPendingException.class,
                () -> changeRequestService.preview(opened.id(), 10, VIEWER));
        assertEquals(409, ex.getStatusCode().value());
    }

    @Test
    @DisplayName("One acknowledgement of warnings covers the remaining approvers")
    void testWarningsAcknowledgedOnce() {
        Long datasetId = newDataset(null,
                List.of(Map.of("type", "allowed_values", "column", "name", "values", List.of("known"))));
        ChangeRequestDTO opened = open(datasetId, List.of(BOB, CAROL), rows(2));
        assertEquals(ValidationState.PARTIAL_PASS, opened.validation().state());

        assertThrows(ValidationFailedException.class, () -> approve(opened.id(), CAROL));

        ChangeRequestDTO first = changeRequestService.decide(opened.id(),
                new DecisionRequest("approve", "warnings reviewed", true), BOB);
        assertEquals("pending", first.status());

        ChangeRequestDTO merged = approve(opened.id(), CAROL);
        assertEquals("approved", merged.status());
        assertFalse(merged.reviewers().get(1).warningsAcknowledged());
        assertEquals(2, canonicalCount(datasetId));
    }
}
