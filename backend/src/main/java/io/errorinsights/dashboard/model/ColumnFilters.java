package io.errorinsights.dashboard.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Immutable mapping of field to its single filter condition. Empty conditions are dropped on construction.
 */
public final class ColumnFilters {

    private static final ColumnFilters EMPTY = new ColumnFilters(Map.of());

    private final Map<LogField, FilterCondition> conditions;

    private ColumnFilters(Map<LogField, FilterCondition> conditions) {
        Map<LogField, FilterCondition> copy = new LinkedHashMap<>();
        conditions.forEach((field, condition) -> {
            if (field != null && condition != null && !condition.isEmpty()) {
                copy.put(field, condition);
            }
        });
        this.conditions = Collections.unmodifiableMap(copy);
    }

    public static ColumnFilters empty() {
        return EMPTY;
    }

    public static ColumnFilters of(Map<LogField, FilterCondition> conditions) {
        return conditions == null || conditions.isEmpty() ? EMPTY : new ColumnFilters(conditions);
    }

    /**
     * Returns a copy where {@code field} carries {@code condition}, replacing any previous condition on it.
     */
    public ColumnFilters with(LogField field, FilterCondition condition) {
        Map<LogField, FilterCondition> merged = new LinkedHashMap<>(conditions);
        merged.put(field, condition);
        return new ColumnFilters(merged);
    }

    public ColumnFilters without(LogField field) {
        if (!conditions.containsKey(field)) {
            return this;
        }
        Map<LogField, FilterCondition> remaining = new LinkedHashMap<>(conditions);
        remaining.remove(field);
        return of(remaining);
    }

    public Map<LogField, FilterCondition> asMap() {
        return conditions;
    }

    public void forEach(BiConsumer<LogField, FilterCondition> action) {
        conditions.forEach(action);
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    public int size() {
        return conditions.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ColumnFilters other && conditions.equals(other.conditions);
    }

    @Override
    public int hashCode() {
        return conditions.hashCode();
    }

    @Override
    public String toString() {
        return conditions.toString();
    }
}
