package org.changeflow.models.enums;

public enum DecisionStatus {
    PENDING,
    APPROVED,
    REJECTED
}
