package org.changeflow.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Base type for lifecycle gate failures. Each subtype carries a stable error code in its problem body
 * and says whether the caller may retry the same call later.
 */
public abstract class ChangeRequestException extends ResponseStatusException {

    private final String errorCode;

    protected ChangeRequestException(HttpStatus status, String errorCode, String message, Throwable cause) {
        super(status, message, cause);
        this.errorCode = errorCode;
        getBody().setTitle(errorCode);
        getBody().setProperty("code", errorCode);
        getBody().setProperty("retryable", isRetryable());
    }

    protected ChangeRequestException(HttpStatus status, String errorCode, String message) {
        this(status, errorCode, message, null);
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return false;
    }

    @Override
    public String getMessage() {
        return getReason();
    }
}
