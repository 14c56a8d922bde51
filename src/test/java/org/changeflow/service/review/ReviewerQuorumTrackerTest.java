package org.changeflow.service.review;

import org.changeflow.exceptions.NotAssignedException;
import org.changeflow.exceptions.NotPendingException;
import org.changeflow.models.entity.ApplicationUser;
import org.changeflow.models.entity.ChangeRequest;
import org.changeflow.models.entity.ReviewerDecision;
import org.changeflow.models.enums.ChangeRequestStatus;
import org.changeflow.models.enums.DecisionStatus;
import org.changeflow.models.enums.QuorumVerdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReviewerQuorumTracker Tests")
class ReviewerQuorumTrackerTest {

    private final ReviewerQuorumTracker tracker = new ReviewerQuorumTracker();

    private static ChangeRequest pendingRequest(String... reviewers) {
        ChangeRequest changeRequest = new ChangeRequest();
        changeRequest.setChangeRequestUid("cr-1");
        changeRequest.setStatus(ChangeRequestStatus.PENDING);
        changeRequest.setRequester(new ApplicationUser("u-0", "requester", "requester@example.com"));
        int position = 0;
        for (String email : reviewers) {
            ReviewerDecision decision = new ReviewerDecision();
            decision.setChangeRequest(changeRequest);
            decision.setReviewer(new ApplicationUser("u-" + email, email, email));
            decision.setPosition(position++);
            decision.setDecision(DecisionStatus.PENDING);
            changeRequest.getDecisions().add(decision);
        }
        return changeRequest;
    }

    @Test
    @DisplayName("Single reviewer approval reaches quorum")
    void testSingleApprove() {
        ChangeRequest changeRequest = pendingRequest("a@example.com");
        assertEquals(QuorumVerdict.APPROVED,
                tracker.recordDecision(changeRequest, "a@example.com", DecisionStatus.APPROVED, null, false));
    }

    @Test
    @DisplayName("Approval stays pending until every reviewer approved")
    void testPartialApprovals() {
        ChangeRequest changeRequest = pendingRequest("a@example.com", "b@example.com", "c@example.com");
        assertEquals(QuorumVerdict.PENDING,
                tracker.recordDecision(changeRequest, "a@example.com", DecisionStatus.APPROVED, null, false));
        assertEquals(QuorumVerdict.PENDING,
                tracker.recordDecision(changeRequest, "c@example.com", DecisionStatus.APPROVED, null, false));
        assertEquals(QuorumVerdict.APPROVED,
                tracker.recordDecision(changeRequest, "b@example.com", DecisionStatus.APPROVED, "ok", false));
    }

    @Test
    @DisplayName("Any rejection decides the request")
    void testRejection() {
        ChangeRequest changeRequest = pendingRequest("a@example.com", "b@example.com");
        assertEquals(QuorumVerdict.REJECTED,
                tracker.recordDecision(changeRequest, "b@example.com", DecisionStatus.REJECTED, "no", false));
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 5, 8})
    @DisplayName("Verdict is independent of the order approvals arrive in")
    void testOrderIndependence(int reviewerCount) {
        Random random = new Random(reviewerCount);
        for (int round = 0; round < 10; round++) {
            String[] reviewers = new String[reviewerCount];
            for (int i = 0; i < reviewerCount; i++) {
                reviewers[i] = "r" + i + "@example.com";
            }
            ChangeRequest changeRequest = pendingRequest(reviewers);
            List<String> order = new ArrayList<>(List.of(reviewers));
            Collections.shuffle(order, random);
            for (int i = 0; i < order.size(); i++) {
                QuorumVerdict verdict = tracker.recordDecision(changeRequest, order.get(i), DecisionStatus.APPROVED, null, false);
                assertEquals(i == order.size() - 1 ? QuorumVerdict.APPROVED : QuorumVerdict.PENDING, verdict);
            }
        }
    }

    @Test
    @DisplayName("Reviewer emails match case-insensitively")
    void testCaseInsensitive() {
        ChangeRequest changeRequest = pendingRequest("a@example.com");
        assertEquals(QuorumVerdict.APPROVED,
                tracker.recordDecision(changeRequest, "A@Example.COM", DecisionStatus.APPROVED, null, true));
        assertTrue(changeRequest.getDecisions().get(0).getWarningsAcknowledged());
        assertNotNull(changeRequest.getDecisions().get(0).getDecidedAt());
    }

    @Test
    @DisplayName("Unassigned actors cannot decide")
    void testNotAssigned() {
        ChangeRequest changeRequest = pendingRequest("a@example.com");
        NotAssignedException ex = assertThrows(NotAssignedException.class,
                () -> tracker.recordDecision(changeRequest, "x@example.com", DecisionStatus.APPROVED, null, false));
        assertEquals("not_assigned", ex.getErrorCode());
    }

    @Test
    @DisplayName("Closed requests reject further decisions")
    void testNotPending() {
        ChangeRequest changeRequest = pendingRequest("a@example.com");
        changeRequest.setStatus(ChangeRequestStatus.WITHDRAWN);
        assertThrows(NotPendingException.class,
                () -> tracker.recordDecision(changeRequest, "a@example.com", DecisionStatus.APPROVED, null, false));
    }

    @Test
    @DisplayName("Pending is not a decision")
    void testPendingDecision() {
        ChangeRequest changeRequest = pendingRequest("a@example.com");
        assertThrows(IllegalArgumentException.class,
                () -> tracker.recordDecision(changeRequest, "a@example.com", DecisionStatus.PENDING, null, false));
    }

    @Test
    @DisplayName("No reviewers means no verdict")
    void testEmpty() {
        assertEquals(QuorumVerdict.PENDING, tracker.verdictOf(List.of()));
        assertEquals(QuorumVerdict.PENDING, tracker.verdictOf(null));
    }
}
