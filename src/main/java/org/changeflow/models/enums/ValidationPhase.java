package org.changeflow.models.enums;

public enum ValidationPhase {
    PROPOSAL,
    COMMIT,
    OVERWRITE
}
