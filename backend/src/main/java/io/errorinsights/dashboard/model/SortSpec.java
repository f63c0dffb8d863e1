package io.errorinsights.dashboard.model;

/**
 * Single-field sort. A missing field or direction means the default order: newest first.
 */
public record SortSpec(LogField field, SortDirection direction) {

    public static final SortSpec DEFAULT = new SortSpec(LogField.LOG_DATE_TIME, SortDirection.DESCENDING);

    public static SortSpec none() {
        return new SortSpec(null, null);
    }

    public SortSpec orDefault() {
        return field == null || direction == null ? DEFAULT : this;
    }
}
