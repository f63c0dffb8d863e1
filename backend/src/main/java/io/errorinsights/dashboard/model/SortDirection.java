package io.errorinsights.dashboard.model;

import java.util.Locale;
import java.util.Optional;

public enum SortDirection {
    ASCENDING,
    DESCENDING;

    public static Optional<SortDirection> fromWireName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "ascending", "asc" -> Optional.of(ASCENDING);
            case "descending", "desc" -> Optional.of(DESCENDING);
            default -> Optional.empty();
        };
    }
}
