package io.errorinsights.dashboard.model;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Column identifiers of a {@link LogRecord} together with their typed accessors.
 * The wire id is what clients send in filters, sort, group-by and export column lists.
 */
public enum LogField {

    LOG_DATE_TIME("log_date_time", "Timestamp", ValueType.TIMESTAMP, LogRecord::logDateTime),
    HOST_NAME("host_name", "Host", ValueType.STRING, LogRecord::hostName),
    REPOSITORY_PATH("repository_path", "Model Name", ValueType.PATH, LogRecord::repositoryPath),
    PORT_NUMBER("port_number", "Port", ValueType.NUMBER, LogRecord::portNumber),
    VERSION_NUMBER("version_number", "AS Version", ValueType.STRING, LogRecord::versionNumber),
    AS_SERVER_MODE("as_server_mode", "Server Mode", ValueType.STRING, LogRecord::asServerMode),
    AS_START_DATE_TIME("as_start_date_time", "Server Start Time", ValueType.TIMESTAMP, LogRecord::asStartDateTime),
    AS_SERVER_CONFIG("as_server_config", "Server Config", ValueType.STRING, LogRecord::asServerConfig),
    USER_ID("user_id", "User", ValueType.STRING, LogRecord::userId),
    REPORT_ID_NAME("report_id_name", "Report Name", ValueType.STRING, LogRecord::reportIdName),
    ERROR_NUMBER("error_number", "Error Code", ValueType.NUMBER, LogRecord::errorNumber),
    XQL_QUERY_ID("xql_query_id", "Query ID", ValueType.STRING, LogRecord::xqlQueryId),
    LOG_MESSAGE("log_message", "Message", ValueType.STRING, LogRecord::logMessage);

    /** Display format for timestamps, always rendered in UTC. */
    public static final DateTimeFormatter DISPLAY_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT).withZone(ZoneOffset.UTC);

    private static final Map<String, LogField> BY_ID = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(LogField::id, Function.identity()));

    private final String id;
    private final String displayName;
    private final ValueType type;
    private final Function<LogRecord, ?> accessor;

    LogField(String id, String displayName, ValueType type, Function<LogRecord, ?> accessor) {
        this.id = id;
        this.displayName = displayName;
        this.type = type;
        this.accessor = accessor;
    }

    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public ValueType type() {
        return type;
    }

    public static Optional<LogField> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_ID.get(id.trim().toLowerCase(Locale.ROOT)));
    }

    public Object value(LogRecord record) {
        return record == null ? null : accessor.apply(record);
    }

    /**
     * Textual form used for filtering, grouping and breakdowns, or {@code null} when the value is missing.
     */
    public String text(LogRecord record) {
        Object value = value(record);
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return DISPLAY_TIMESTAMP.format(instant);
        }
        return value.toString();
    }

    public String textOr(LogRecord record, String fallback) {
        String text = text(record);
        return text == null ? fallback : text;
    }

    public enum ValueType {
        TIMESTAMP,
        NUMBER,
        STRING,
        /** Slash separated hierarchical path, shortened to its last segment on export. */
        PATH
    }
}
