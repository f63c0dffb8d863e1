package io.errorinsights.dashboard.service;

import io.errorinsights.dashboard.config.QueryEngineProperties;
import io.errorinsights.dashboard.engine.QueryException;
import io.errorinsights.dashboard.model.ColumnFilters;
import io.errorinsights.dashboard.model.FilterCondition;
import io.errorinsights.dashboard.model.FilterOperator;
import io.errorinsights.dashboard.model.LogField;
import io.errorinsights.dashboard.model.SortDirection;
import io.errorinsights.dashboard.model.SortSpec;
import io.errorinsights.dashboard.model.TimeWindow;
import io.errorinsights.dashboard.service.dto.LogsQueryRequest;
import io.errorinsights.dashboard.service.dto.QueryParameters;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

/**
 * Validates a raw {@link LogsQueryRequest} and resolves it into {@link QueryParameters}.
 * Every rejection happens here, so a bad request never reaches a query stage.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueryRequestMapper {

    private final QueryEngineProperties properties;
    private final TimeWindowResolver windowResolver;
    private final QueryFilterPolicy filterPolicy;

    public QueryParameters toParameters(LogsQueryRequest request) {
        if (request == null) {
            throw QueryException.invalidArgument("Query request is missing");
        }
        Optional<TimeWindow> window = windowResolver.resolve(request.timeWindow(), request.interval());

        int page = 1;
        int size = properties.getDefaultPageSize();
        if (request.pagination() != null) {
            if (request.pagination().page() != null) {
                page = request.pagination().page();
            }
            if (request.pagination().pageSize() != null) {
                size = request.pagination().pageSize();
            }
        }
        if (size <= 0) {
            throw QueryException.invalidArgument("pageSize must be positive, got " + size);
        }
        if (page < 1) {
            throw QueryException.invalidArgument("page must be 1 or greater, got " + page);
        }
        size = Math.min(size, properties.getMaxPageSize());

        ColumnFilters filters = filterPolicy.apply(toFilters(request.filters()));

        return new QueryParameters(
                request.requestId(),
                window,
                page,
                size,
                toSort(request.sort()),
                filters,
                toFields(request.groupBy(), "groupBy"),
                optionalField(request.breakdownField(), "breakdownField")
        );
    }

    /**
     * Resolves drill-down keys (field id to clicked group or breakdown key). Keys on fields the
     * filter policy controls are ignored.
     */
    public Map<LogField, String> toDrillDownKeys(Map<String, String> keys) {
        Map<LogField, String> resolved = new LinkedHashMap<>();
        if (CollectionUtils.isEmpty(keys)) {
            return resolved;
        }
        keys.forEach((id, key) -> {
            LogField field = requireField(id, "drill-down key");
            if (key == null) {
                throw QueryException.invalidArgument("Drill-down key for '" + id + "' is missing");
            }
            if (filterPolicy.allowsDrillDown(field)) {
                resolved.put(field, key);
            } else {
                log.debug("Ignoring drill-down on policy controlled field '{}'", id);
            }
        });
        return resolved;
    }

    public List<LogField> toColumns(Collection<String> ids) {
        List<LogField> columns = toFields(ids, "columns");
        return columns.isEmpty() ? List.of(LogField.values()) : columns;
    }

    private ColumnFilters toFilters(Map<String, LogsQueryRequest.Filter> raw) {
        if (CollectionUtils.isEmpty(raw)) {
            return ColumnFilters.empty();
        }
        Map<LogField, FilterCondition> conditions = new LinkedHashMap<>();
        raw.forEach((id, filter) -> {
            LogField field = requireField(id, "filter");
            if (filter == null) {
                return;
            }
            FilterOperator operator = StringUtils.hasText(filter.operator())
                    ? FilterOperator.fromWireName(filter.operator()).orElseThrow(() ->
                            QueryException.invalidArgument("Unknown filter operator '" + filter.operator()
                                    + "' for field '" + id + "'"))
                    : FilterOperator.IN;
            conditions.put(field, new FilterCondition(operator, filter.values()));
        });
        return ColumnFilters.of(conditions);
    }

    private SortSpec toSort(LogsQueryRequest.Sort sort) {
        if (sort == null || !StringUtils.hasText(sort.field())) {
            return SortSpec.none();
        }
        LogField field = requireField(sort.field(), "sort");
        if (!StringUtils.hasText(sort.direction())) {
            return SortSpec.none();
        }
        SortDirection direction = SortDirection.fromWireName(sort.direction()).orElseThrow(() ->
                QueryException.invalidArgument("Unknown sort direction '" + sort.direction() + "'"));
        return new SortSpec(field, direction);
    }

    private List<LogField> toFields(Collection<String> ids, String what) {
        if (CollectionUtils.isEmpty(ids)) {
            return List.of();
        }
        List<LogField> fields = new ArrayList<>(ids.size());
        for (String id : ids) {
            fields.add(requireField(id, what));
        }
        return fields;
    }

    private Optional<LogField> optionalField(String id, String what) {
        return StringUtils.hasText(id) ? Optional.of(requireField(id, what)) : Optional.empty();
    }

    private LogField requireField(String id, String what) {
        return LogField.fromId(id).orElseThrow(() ->
                QueryException.invalidArgument("Unknown field '" + id + "' in " + what));
    }
}
