package org.changeflow.models.enums;

/**
 * Aggregate outcome of every assigned reviewer's decision on one change request.
 */
public enum QuorumVerdict {
    PENDING,
    APPROVED,
    REJECTED
}
