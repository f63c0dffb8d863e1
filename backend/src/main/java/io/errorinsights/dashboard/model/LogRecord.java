package io.errorinsights.dashboard.model;

import java.time.Instant;
import lombok.Builder;

/**
 * One error log entry as handed out by a {@link io.errorinsights.dashboard.source.LogRecordSource}.
 * Any component may be {@code null}; the query stages treat a {@code null} value as "missing".
 */
@Builder(toBuilder = true)
public record LogRecord(
        String id,
        Instant logDateTime,
        String hostName,
        String repositoryPath,
        Integer portNumber,
        String versionNumber,
        String asServerMode,
        Instant asStartDateTime,
        String asServerConfig,
        String userId,
        String reportIdName,
        Integer errorNumber,
        String xqlQueryId,
        String logMessage) {
}
