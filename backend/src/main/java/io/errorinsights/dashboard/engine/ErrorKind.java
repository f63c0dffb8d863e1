package io.errorinsights.dashboard.engine;

public enum ErrorKind {
    /** The request cannot be evaluated as given: bad paging, window, interval, field id or operator. */
    INVALID_ARGUMENT
}
