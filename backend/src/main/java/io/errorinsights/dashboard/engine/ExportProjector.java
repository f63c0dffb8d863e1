package io.errorinsights.dashboard.engine;

import io.errorinsights.dashboard.model.LogField;
import io.errorinsights.dashboard.model.LogRecord;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Turns records into flat rows of display strings for a chosen column list.
 */
@Component
public class ExportProjector {

    private static final char CSV_DELIMITER = ',';
    private static final char CSV_QUOTE = '"';

    public List<List<String>> project(List<LogRecord> records, List<LogField> columns) {
        return records.stream()
                .map(record -> columns.stream().map(column -> cell(record, column)).toList())
                .toList();
    }

    public String cell(LogRecord record, LogField column) {
        String text = column.text(record);
        if (text == null) {
            return "";
        }
        if (column.type() == LogField.ValueType.PATH) {
            int lastSlash = text.lastIndexOf('/');
            return lastSlash >= 0 ? text.substring(lastSlash + 1) : text;
        }
        return text;
    }

    public String csvHeader(List<LogField> columns) {
        return columns.stream().map(LogField::id).collect(Collectors.joining(String.valueOf(CSV_DELIMITER)));
    }

    public String csvRow(List<String> cells) {
        return cells.stream().map(ExportProjector::escapeCsv).collect(Collectors.joining(String.valueOf(CSV_DELIMITER)));
    }

    static String escapeCsv(String value) {
        if (value == null) {
            return "";
        }
        boolean needsQuotes = value.indexOf(CSV_DELIMITER) >= 0
                || value.indexOf(CSV_QUOTE) >= 0
                || value.indexOf('\n') >= 0
                || value.indexOf('\r') >= 0;
        if (!needsQuotes) {
            return value;
        }
        return CSV_QUOTE + value.replace("\"", "\"\"") + CSV_QUOTE;
    }
}
