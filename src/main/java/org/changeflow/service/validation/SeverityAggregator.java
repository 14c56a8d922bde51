package org.changeflow.service.validation;

import org.changeflow.models.enums.ValidationState;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reduces an ordered list of rule outcomes to one validation state. Stateless; the same list always yields
 * the same report.
 */
@Component
public class SeverityAggregator {

    public ValidationReport aggregate(List<ValidationOutcome> outcomes) {
        List<ValidationOutcome> items = outcomes == null ? List.of() : outcomes.stream()
                .filter(outcome -> outcome != null && outcome.severity() != null)
                .toList();
        int info = 0;
        int warning = 0;
        int error = 0;
        int fatal = 0;
        for (ValidationOutcome outcome : items) {
            switch (outcome.severity()) {
                case INFO -> info++;
                case WARNING -> warning++;
                case ERROR -> error++;
                case FATAL -> fatal++;
            }
        }
        SeverityCounts counts = new SeverityCounts(info, warning, error, fatal);
        return new ValidationReport(stateOf(counts), counts, items);
    }

    static ValidationState stateOf(SeverityCounts counts) {
        if (counts.fatal() > 0) {
            return ValidationState.FAILED;
        }
        if (counts.error() > 0) {
            return ValidationState.FAILED;
        }
        if (counts.warning() > 0) {
            return ValidationState.PARTIAL_PASS;
        }
        return ValidationState.PASSED;
    }
}
