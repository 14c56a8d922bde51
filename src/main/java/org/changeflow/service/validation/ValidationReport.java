package org.changeflow.service.validation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.changeflow.models.enums.ValidationState;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ValidationReport(ValidationState state, SeverityCounts counts, List<ValidationOutcome> items) {

    public ValidationReport {
        items = items == null ? List.of() : List.copyOf(items);
        counts = counts == null ? SeverityCounts.EMPTY : counts;
    }

    public static ValidationReport notStarted() {
        return new ValidationReport(ValidationState.NOT_STARTED, SeverityCounts.EMPTY, List.of());
    }

    @JsonIgnore
    public boolean isFailed() {
        return state == ValidationState.FAILED;
    }

    @JsonIgnore
    public boolean isPartialPass() {
        return state == ValidationState.PARTIAL_PASS;
    }
}
