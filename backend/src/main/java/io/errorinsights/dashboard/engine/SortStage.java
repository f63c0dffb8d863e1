package io.errorinsights.dashboard.engine;

import io.errorinsights.dashboard.model.LogField;
import io.errorinsights.dashboard.model.LogRecord;
import io.errorinsights.dashboard.model.SortDirection;
import io.errorinsights.dashboard.model.SortSpec;
import java.text.Collator;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Stable single-field sort. Records without a value for the sort field always go last,
 * whatever the direction.
 */
@Component
public class SortStage {

    public List<LogRecord> sort(List<LogRecord> records, SortSpec sort) {
        SortSpec effective = sort == null ? SortSpec.DEFAULT : sort.orDefault();
        List<LogRecord> sorted = new ArrayList<>(records);
        sorted.sort(comparator(effective));
        return sorted;
    }

    Comparator<LogRecord> comparator(SortSpec sort) {
        LogField field = sort.field();
        Comparator<Object> values = valueComparator(field);
        if (sort.direction() == SortDirection.DESCENDING) {
            values = values.reversed();
        }
        Comparator<Object> present = values;
        return (left, right) -> {
            Object a = field.value(left);
            Object b = field.value(right);
            if (a == null || b == null) {
                return a == null ? (b == null ? 0 : 1) : -1;
            }
            return present.compare(a, b);
        };
    }

    private Comparator<Object> valueComparator(LogField field) {
        return switch (field.type()) {
            case TIMESTAMP -> (a, b) -> ((Instant) a).compareTo((Instant) b);
            case NUMBER -> (a, b) -> Long.compare(((Number) a).longValue(), ((Number) b).longValue());
            case STRING, PATH -> {
                Collator collator = Collator.getInstance();
                yield (a, b) -> collator.compare(a.toString(), b.toString());
            }
        };
    }
}
