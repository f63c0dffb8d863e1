package io.errorinsights.dashboard.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Operator plus an ordered, de-duplicated set of values. A condition without values filters nothing.
 * Substring values are trimmed and blank ones dropped; {@link FilterOperator#EQUALS} keys are kept verbatim.
 */
public record FilterCondition(FilterOperator operator, List<String> values) {

    public FilterCondition {
        Objects.requireNonNull(operator, "operator");
        Set<String> unique = new LinkedHashSet<>();
        if (values != null) {
            for (String value : values) {
                if (value == null) {
                    continue;
                }
                if (operator == FilterOperator.EQUALS) {
                    unique.add(value);
                } else if (!value.isBlank()) {
                    unique.add(value.trim());
                }
            }
        }
        values = List.copyOf(unique);
    }

    public static FilterCondition in(String... values) {
        return new FilterCondition(FilterOperator.IN, List.of(values));
    }

    public static FilterCondition notIn(String... values) {
        return new FilterCondition(FilterOperator.NOT_IN, List.of(values));
    }

    public static FilterCondition containsAll(String... values) {
        return new FilterCondition(FilterOperator.CONTAINS_ALL, List.of(values));
    }

    public static FilterCondition equalTo(String... keys) {
        return new FilterCondition(FilterOperator.EQUALS, List.of(keys));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
