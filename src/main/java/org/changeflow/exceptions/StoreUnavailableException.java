package org.changeflow.exceptions;

import org.springframework.http.HttpStatus;

public class StoreUnavailableException extends ChangeRequestException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "store_unavailable", message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
