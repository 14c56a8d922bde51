package org.changeflow.models.enums;

import java.util.Locale;

/**
 * Graded importance of a validation finding, ordered from least to most severe.
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR,
    FATAL;

    public static Severity parse(String value, Severity fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return fallback;
        }
    }
}
