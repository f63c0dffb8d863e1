package io.errorinsights.dashboard.source;

import io.errorinsights.dashboard.model.LogRecord;
import java.util.List;

/**
 * Read-only access to the log records the dashboard browses. Implementations hand out an
 * immutable snapshot; query stages never modify it.
 */
public interface LogRecordSource {

    List<LogRecord> snapshot();
}
