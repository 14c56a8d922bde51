package org.changeflow.exceptions;

import org.changeflow.service.validation.ValidationReport;
import org.springframework.http.HttpStatus;

public class ValidationFailedException extends ChangeRequestException {

    private final transient ValidationReport report;

    public ValidationFailedException(String message, ValidationReport report) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "validation_failed", message);
        this.report = report;
        getBody().setProperty("validation", report);
    }

    public ValidationReport getReport() {
        return report;
    }
}
