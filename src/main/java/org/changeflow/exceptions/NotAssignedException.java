package org.changeflow.exceptions;

import org.springframework.http.HttpStatus;

public class NotAssignedException extends ChangeRequestException {

    public NotAssignedException(String reviewer, String changeRequestUid) {
        super(HttpStatus.FORBIDDEN, "not_assigned",
                reviewer + " is not an assigned reviewer of change request " + changeRequestUid);
    }
}
