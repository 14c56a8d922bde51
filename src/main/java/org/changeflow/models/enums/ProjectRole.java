package org.changeflow.models.enums;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of project roles. A role with a higher rank satisfies every check that asks for a lower one.
 */
public enum ProjectRole {
    VIEWER(1),
    APPROVER(2),
    CONTRIBUTOR(3),
    OWNER(4);

    private final int rank;

    ProjectRole(int rank) {
        this.rank = rank;
    }

    public boolean satisfies(ProjectRole required) {
        return required != null && rank >= required.rank;
    }

    /**
     * Maps a stored role string onto the enum. Case and surrounding whitespace are ignored and the
     * legacy {@code editor} alias resolves to {@link #CONTRIBUTOR}.
     */
    public static Optional<ProjectRole> normalize(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "owner" -> Optional.of(OWNER);
            case "contributor", "editor" -> Optional.of(CONTRIBUTOR);
            case "approver" -> Optional.of(APPROVER);
            case "viewer" -> Optional.of(VIEWER);
            default -> Optional.empty();
        };
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
