package org.changeflow.exceptions;

import org.changeflow.models.enums.ChangeRequestStatus;
import org.springframework.http.HttpStatus;

/**
 * Raised for any mutation attempted on a change request that already reached a terminal status.
 */
public class NotPendingException extends ChangeRequestException {

    private final ChangeRequestStatus status;

    public NotPendingException(String changeRequestUid, ChangeRequestStatus status) {
        super(HttpStatus.CONFLICT, "not_pending",
                "Change request " + changeRequestUid + " is " + status.wireName());
        this.status = status;
        getBody().setProperty("status", status.wireName());
    }

    public ChangeRequestStatus getStatus() {
        return status;
    }
}
