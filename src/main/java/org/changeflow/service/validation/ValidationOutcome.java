package org.changeflow.service.validation;

import org.changeflow.models.enums.Severity;

/**
 * One finding produced by rule evaluation. {@code rowIndex} is zero-based and null for findings that are
 * not tied to a single row.
 */
public record ValidationOutcome(Severity severity,
                                String ruleType,
                                String column,
                                Integer rowIndex,
                                String message) {

    public static ValidationOutcome of(Severity severity, String ruleType, String column, Integer rowIndex, String message) {
        return new ValidationOutcome(severity, ruleType, column, rowIndex, message);
    }
}
