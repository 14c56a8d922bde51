package org.changeflow.service.merge;

import org.changeflow.adapters.RowStore;
import org.changeflow.exceptions.MergeAbortedException;
import org.changeflow.exceptions.StoreUnavailableException;
import org.changeflow.models.dto.ChangeRequestDTO;
import org.changeflow.models.dto.ChangeRequestEventDTO;
import org.changeflow.service.lifecycle.LifecycleTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;

@DisplayName("Merge failure recovery Tests")
class MergeFailureRecoveryTest extends LifecycleTestSupport {

    @SpyBean
    private RowStore spiedRowStore;

    @Test
    @DisplayName("Unreachable store during append keeps staging and approvals for a retry")
    void testAppendFailure() {
        Long datasetId = newDataset();
        ChangeRequestDTO opened = open(datasetId, List.of(BOB), rows(5));
        doThrow(new DataAccessResourceFailureException("connection reset"))
                .when(spiedRowStore).appendFrom(any(), any());

        StoreUnavailableException ex = assertThrows(StoreUnavailableException.class, () -> approve(opened.id(), BOB));
        assertTrue(ex.isRetryable());

        ChangeRequestDTO failed = changeRequestService.get(opened.id(), REQUESTER);
        assertEquals("pending", failed.status());
        assertEquals("failed", failed.mergeState());
        assertEquals(1, failed.mergeAttempts());
        assertEquals("approved", failed.reviewers().get(0).decision());
        assertEquals(0, canonicalCount(datasetId));
        assertTrue(stagingExists(datasetId, opened.id()));
        assertEquals(5, rowStore.countRows(tableNamespace.staging(datasetId,
                changeRequestRepository.findByChangeRequestUid(opened.id()).orElseThrow().getId())));
        assertTrue(changeRequestService.events(opened.id(), REQUESTER).stream()
                .map(ChangeRequestEventDTO::type)
                .anyMatch("merge_failed"::equals));

        doCallRealMethod().when(spiedRowStore).appendFrom(any(), any());
        ChangeRequestDTO merged = changeRequestService.retryMerge(opened.id(), BOB);

        assertEquals("approved", merged.status());
        assertEquals(2, merged.mergeAttempts());
        assertEquals(5, canonicalCount(datasetId));
        assertFalse(stagingExists(datasetId, opened.id()));
    }

    @Test
    @DisplayName("Failure after the append rolls the canonical table back to its previous count")
    void testFailureAfterAppend() {
        Long datasetId = newDataset();
        ChangeRequestDTO first = open(datasetId, List.of(BOB), rows(2));
        approve(first.id(), BOB);
        assertEquals(2, canonicalCount(datasetId));

        ChangeRequestDTO second = open(datasetId, List.of(BOB), rows(3));
        doThrow(new IllegalStateException("interrupted")).when(spiedRowStore).dropTable(any());

        MergeAbortedException ex = assertThrows(MergeAbortedException.class, () -> approve(second.id(), BOB));
        assertTrue(ex.getReason().contains("interrupted"));

        assertEquals(2, canonicalCount(datasetId));
        assertTrue(stagingExists(datasetId, second.id()));
        assertEquals("pending", changeRequestService.get(second.id(), REQUESTER).status());
        assertEquals(2, datasetService.meta(datasetId, OWNER).rowCount());

        doCallRealMethod().when(spiedRowStore).dropTable(any());
        ChangeRequestDTO merged = changeRequestService.retryMerge(second.id(), BOB);

        assertEquals("approved", merged.status());
        assertEquals(5, canonicalCount(datasetId));
        assertFalse(stagingExists(datasetId, second.id()));
    }
}
