package org.changeflow.exceptions;

import org.springframework.http.HttpStatus;

public class ForbiddenException extends ChangeRequestException {

    public ForbiddenException(String message) {
        super(HttpStatus.FORBIDDEN, "forbidden", message);
    }
}
