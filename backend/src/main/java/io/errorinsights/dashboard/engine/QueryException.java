package io.errorinsights.dashboard.engine;

import lombok.Getter;

/**
 * Raised for requests that are rejected before any query stage runs.
 */
@Getter
public class QueryException extends RuntimeException {

    private final ErrorKind kind;

    public QueryException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public QueryException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static QueryException invalidArgument(String message) {
        return new QueryException(ErrorKind.INVALID_ARGUMENT, message);
    }

    public static QueryException invalidArgument(String message, Throwable cause) {
        return new QueryException(ErrorKind.INVALID_ARGUMENT, message, cause);
    }
}
