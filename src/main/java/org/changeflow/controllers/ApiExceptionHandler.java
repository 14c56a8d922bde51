package org.changeflow.controllers;

import lombok.extern.slf4j.Slf4j;
import org.changeflow.exceptions.ChangeRequestException;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Renders errors as RFC 7807 problem documents. Lifecycle gate failures already carry their code and
 * extra properties in their body.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler(ChangeRequestException.class)
    public ResponseEntity<ProblemDetail> handleChangeRequest(ChangeRequestException e) {
        ProblemDetail body = e.getBody();
        body.setProperty("requestId", MDC.get("requestId"));
        if (e.isRetryable()) {
            log.warn("{}: {}", e.getErrorCode(), e.getReason());
        } else {
            log.info("{}: {}", e.getErrorCode(), e.getReason());
        }
        return ResponseEntity.status(e.getStatusCode()).body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleBadRequest(IllegalArgumentException e) {
        ProblemDetail body = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, e.getMessage());
        body.setProperty("code", "bad_request");
        body.setProperty("requestId", MDC.get("requestId"));
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ProblemDetail> handleConstraint(DataIntegrityViolationException e) {
        log.info("Constraint violation: {}", e.getMostSpecificCause().getMessage());
        ProblemDetail body = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST,
                "Request violates a storage constraint");
        body.setProperty("code", "constraint_violation");
        body.setProperty("requestId", MDC.get("requestId"));
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(DataAccessResourceFailureException.class)
    public ResponseEntity<ProblemDetail> handleStoreDown(DataAccessResourceFailureException e) {
        log.error("Store unavailable", e);
        ProblemDetail body = ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, "Storage is unavailable, retry later");
        body.setProperty("code", "store_unavailable");
        body.setProperty("retryable", true);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
