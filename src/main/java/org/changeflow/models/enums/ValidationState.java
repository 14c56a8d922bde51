package org.changeflow.models.enums;

public enum ValidationState {
    NOT_STARTED,
    IN_PROGRESS,
    PARTIAL_PASS,
    PASSED,
    FAILED
}
