package org.changeflow.models.enums;

public enum GateAction {
    PROPOSE(ProjectRole.CONTRIBUTOR),
    DECIDE(ProjectRole.APPROVER),
    WITHDRAW(ProjectRole.VIEWER),
    READ(ProjectRole.VIEWER),
    COMMENT(ProjectRole.VIEWER),
    MANAGE_DATASET(ProjectRole.OWNER);

    private final ProjectRole minimumRole;

    GateAction(ProjectRole minimumRole) {
        this.minimumRole = minimumRole;
    }

    public ProjectRole getMinimumRole() {
        return minimumRole;
    }
}
