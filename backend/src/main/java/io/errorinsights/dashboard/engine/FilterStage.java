package io.errorinsights.dashboard.engine;

import io.errorinsights.dashboard.model.ColumnFilters;
import io.errorinsights.dashboard.model.FilterCondition;
import io.errorinsights.dashboard.model.LogField;
import io.errorinsights.dashboard.model.LogRecord;
import io.errorinsights.dashboard.model.TimeWindow;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Keeps the records satisfying every column condition, preserving their order.
 */
@Component
@RequiredArgsConstructor
public class FilterStage {

    private final PredicateEvaluator evaluator;

    public List<LogRecord> filter(List<LogRecord> records, ColumnFilters filters) {
        if (filters == null || filters.isEmpty()) {
            return List.copyOf(records);
        }
        Map<LogField, FilterCondition> conditions = filters.asMap();
        return records.stream()
                .filter(record -> matchesAll(record, conditions))
                .toList();
    }

    public List<LogRecord> filter(List<LogRecord> records, TimeWindow window, ColumnFilters filters) {
        List<LogRecord> inWindow = records.stream()
                .filter(record -> window.contains(record.logDateTime()))
                .toList();
        return filter(inWindow, filters);
    }

    private boolean matchesAll(LogRecord record, Map<LogField, FilterCondition> conditions) {
        for (Map.Entry<LogField, FilterCondition> entry : conditions.entrySet()) {
            if (!evaluator.matches(record, entry.getKey(), entry.getValue())) {
                return false;
            }
        }
        return true;
    }
}
