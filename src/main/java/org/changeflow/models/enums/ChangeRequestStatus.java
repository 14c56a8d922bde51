package org.changeflow.models.enums;

import java.util.Locale;
import java.util.Optional;

public enum ChangeRequestStatus {
    PENDING,
    APPROVED,
    REJECTED,
    WITHDRAWN;

    public boolean isTerminal() {
        return this != PENDING;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ChangeRequestStatus> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ChangeRequestStatus status : values()) {
            if (status.name().equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
