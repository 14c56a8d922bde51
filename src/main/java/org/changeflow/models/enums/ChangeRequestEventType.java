package org.changeflow.models.enums;

public enum ChangeRequestEventType {
    CREATED,
    DECISION_RECORDED,
    APPROVED,
    REJECTED,
    WITHDRAWN,
    MERGED,
    MERGE_FAILED,
    COMMENTED
}
