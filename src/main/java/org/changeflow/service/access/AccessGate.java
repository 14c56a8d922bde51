package org.changeflow.service.access;

import org.changeflow.models.enums.GateAction;
import org.changeflow.models.enums.ProjectRole;

/**
 * Role-only permission check. Identity-dependent rules (assigned reviewer, original requester) are
 * layered on top by {@link ProjectAccessService}.
 */
public final class AccessGate {

    private AccessGate() {
    }

    public static boolean allowed(ProjectRole role, GateAction action) {
        if (role == null || action == null) {
            return false;
        }
        return role.satisfies(action.getMinimumRole());
    }
}
