package org.changeflow.exceptions;

import org.changeflow.service.validation.ValidationReport;
import org.springframework.http.HttpStatus;

/**
 * The commit of an approved change request did not happen. Staged rows and reviewer decisions are kept.
 */
public class MergeAbortedException extends ChangeRequestException {

    private final transient ValidationReport report;

    public MergeAbortedException(String message, ValidationReport report, Throwable cause) {
        super(HttpStatus.CONFLICT, "merge_aborted", message, cause);
        this.report = report;
        if (report != null) {
            getBody().setProperty("validation", report);
        }
    }

    public MergeAbortedException(String message) {
        this(message, null, null);
    }

    public ValidationReport getReport() {
        return report;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
