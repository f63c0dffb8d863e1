package io.errorinsights.dashboard.engine;

import io.errorinsights.dashboard.config.QueryEngineProperties;
import io.errorinsights.dashboard.model.FilterCondition;
import io.errorinsights.dashboard.model.FilterOperator;
import io.errorinsights.dashboard.model.LogField;
import io.errorinsights.dashboard.model.LogRecord;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Case-insensitive substring matching of one field against one condition. {@link FilterOperator#EQUALS}
 * compares against the same keys the grouping and breakdown stages produce.
 */
@Component
public class PredicateEvaluator {

    private final String missingLabel;

    public PredicateEvaluator(QueryEngineProperties properties) {
        this.missingLabel = properties.getMissingLabel();
    }

    public boolean matches(LogRecord record, LogField field, FilterCondition condition) {
        if (condition == null || condition.isEmpty()) {
            return true;
        }
        if (condition.operator() == FilterOperator.EQUALS) {
            return condition.values().contains(field.textOr(record, missingLabel));
        }
        String text = field.text(record);
        if (text == null) {
            // "contains none of" holds for a missing value, the other operators cannot
            return condition.operator() == FilterOperator.NOT_IN;
        }
        String haystack = text.toLowerCase(Locale.ROOT);
        List<String> needles = condition.values().stream()
                .map(value -> value.toLowerCase(Locale.ROOT))
                .toList();
        return switch (condition.operator()) {
            case IN -> needles.stream().anyMatch(haystack::contains);
            case NOT_IN -> needles.stream().noneMatch(haystack::contains);
            case CONTAINS_ALL -> needles.stream().allMatch(haystack::contains);
            case EQUALS -> condition.values().contains(text);
        };
    }
}
