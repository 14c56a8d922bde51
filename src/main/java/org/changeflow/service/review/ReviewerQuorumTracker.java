package org.changeflow.service.review;

import lombok.extern.slf4j.Slf4j;
import org.changeflow.exceptions.NotAssignedException;
import org.changeflow.exceptions.NotPendingException;
import org.changeflow.models.entity.ChangeRequest;
import org.changeflow.models.entity.ReviewerDecision;
import org.changeflow.models.enums.DecisionStatus;
import org.changeflow.models.enums.QuorumVerdict;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;

/**
 * Unanimous quorum over the reviewer set fixed when the request was opened. Any rejection decides the
 * request; approval needs every assigned reviewer. Callers hold the change request row lock.
 */
@Slf4j
@Component
public class ReviewerQuorumTracker {

    public QuorumVerdict recordDecision(ChangeRequest changeRequest,
                                        String reviewerEmail,
                                        DecisionStatus decision,
                                        String comment,
                                        boolean warningsAcknowledged) {
        if (decision == null || decision == DecisionStatus.PENDING) {
            throw new IllegalArgumentException("Decision must be approved or rejected");
        }
        if (!changeRequest.isPending()) {
            throw new NotPendingException(changeRequest.getChangeRequestUid(), changeRequest.getStatus());
        }
        ReviewerDecision slot = changeRequest.decisionOf(reviewerEmail)
                .orElseThrow(() -> new NotAssignedException(reviewerEmail, changeRequest.getChangeRequestUid()));
        slot.setDecision(decision);
        slot.setComment(comment);
        slot.setDecidedAt(Instant.now());
        slot.setWarningsAcknowledged(warningsAcknowledged);
        QuorumVerdict verdict = verdictOf(changeRequest.getDecisions());
        log.debug("Reviewer {} {} change request {}, verdict {}", reviewerEmail, decision,
                changeRequest.getChangeRequestUid(), verdict);
        return verdict;
    }

    public QuorumVerdict verdictOf(Collection<ReviewerDecision> decisions) {
        if (decisions == null || decisions.isEmpty()) {
            return QuorumVerdict.PENDING;
        }
        boolean allApproved = true;
        for (ReviewerDecision decision : decisions) {
            if (decision.getDecision() == DecisionStatus.REJECTED) {
                return QuorumVerdict.REJECTED;
            }
            if (decision.getDecision() != DecisionStatus.APPROVED) {
                allApproved = false;
            }
        }
        return allApproved ? QuorumVerdict.APPROVED : QuorumVerdict.PENDING;
    }
}
