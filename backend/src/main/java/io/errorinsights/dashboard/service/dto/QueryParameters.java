package io.errorinsights.dashboard.service.dto;

import io.errorinsights.dashboard.model.ColumnFilters;
import io.errorinsights.dashboard.model.LogField;
import io.errorinsights.dashboard.model.SortSpec;
import io.errorinsights.dashboard.model.TimeWindow;
import java.util.List;
import java.util.Optional;

/**
 * Validated query. An empty window means the caller picked no time range and nothing is scanned.
 */
public record QueryParameters(
        String requestId,
        Optional<TimeWindow> window,
        int page,
        int pageSize,
        SortSpec sort,
        ColumnFilters filters,
        List<LogField> groupBy,
        Optional<LogField> breakdownField) {

    public QueryParameters {
        window = window == null ? Optional.empty() : window;
        sort = sort == null ? SortSpec.none() : sort;
        filters = filters == null ? ColumnFilters.empty() : filters;
        groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
        breakdownField = breakdownField == null ? Optional.empty() : breakdownField;
    }

    public QueryParameters withFilters(ColumnFilters newFilters) {
        return new QueryParameters(requestId, window, page, pageSize, sort, newFilters, groupBy, breakdownField);
    }

    public QueryParameters withoutGrouping() {
        return new QueryParameters(requestId, window, page, pageSize, sort, filters, List.of(), breakdownField);
    }
}
