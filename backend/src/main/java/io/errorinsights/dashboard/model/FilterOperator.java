package io.errorinsights.dashboard.model;

import java.util.Arrays;
import java.util.Optional;

public enum FilterOperator {

    /** Value contains at least one of the condition values. */
    IN("in"),
    /** Value contains none of the condition values. */
    NOT_IN("notIn"),
    /** Value contains every condition value. */
    CONTAINS_ALL("and"),
    /**
     * Text equals one of the condition values exactly; a missing value compares as the missing label.
     * Used for drill-down keys and not accepted from clients.
     */
    EQUALS("equals");

    private final String wireName;

    FilterOperator(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<FilterOperator> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim();
        return Arrays.stream(values())
                .filter(op -> op != EQUALS)
                .filter(op -> op.wireName.equalsIgnoreCase(normalized)
                        || op.name().equalsIgnoreCase(normalized.replace('-', '_')))
                .findFirst();
    }
}
