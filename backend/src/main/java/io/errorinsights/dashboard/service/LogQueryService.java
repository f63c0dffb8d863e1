package io.errorinsights.dashboard.service;

import io.errorinsights.dashboard.engine.BucketPolicy;
import io.errorinsights.dashboard.engine.ExportProjector;
import io.errorinsights.dashboard.engine.FilterStage;
import io.errorinsights.dashboard.engine.GroupingStage;
import io.errorinsights.dashboard.engine.PaginationStage;
import io.errorinsights.dashboard.engine.SortStage;
import io.errorinsights.dashboard.engine.TimeBucketingStage;
import io.errorinsights.dashboard.model.ColumnFilters;
import io.errorinsights.dashboard.model.FilterCondition;
import io.errorinsights.dashboard.model.GroupNode;
import io.errorinsights.dashboard.model.LogField;
import io.errorinsights.dashboard.model.LogRecord;
import io.errorinsights.dashboard.model.TimeWindow;
import io.errorinsights.dashboard.model.TrendPoint;
import io.errorinsights.dashboard.service.dto.ExportRows;
import io.errorinsights.dashboard.service.dto.QueryParameters;
import io.errorinsights.dashboard.service.dto.QueryResult;
import io.errorinsights.dashboard.source.LogRecordSource;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the query stages in the order each request kind needs. Every call filters the current
 * snapshot of the record source first; requests without a time window return an empty result
 * without scanning.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LogQueryService {

    private final LogRecordSource recordSource;
    private final FilterStage filterStage;
    private final SortStage sortStage;
    private final GroupingStage groupingStage;
    private final TimeBucketingStage bucketingStage;
    private final BucketPolicy bucketPolicy;
    private final PaginationStage paginationStage;
    private final ExportProjector exportProjector;

    /**
     * Dashboard view: trend of the whole filtered population, plus either the group forest
     * (when grouping) or one sorted page.
     */
    public QueryResult query(QueryParameters parameters) {
        if (parameters.window().isEmpty()) {
            return emptyResult(parameters, "query");
        }
        TimeWindow window = parameters.window().get();
        bucketPolicy.checkBucketCount(window);

        List<LogRecord> filtered = applyFilters(parameters, window);
        List<TrendPoint> chart = bucketingStage.bucketTrend(
                filtered, window, parameters.breakdownField().orElse(null));

        QueryResult result;
        if (!parameters.groupBy().isEmpty()) {
            List<GroupNode> groups = groupingStage.group(filtered, parameters.groupBy());
            result = new QueryResult(parameters.requestId(), List.of(), filtered.size(), groups, chart);
        } else {
            result = new QueryResult(parameters.requestId(), page(filtered, parameters), filtered.size(), List.of(), chart);
        }
        logResult("query", result);
        return result;
    }

    /**
     * Listing: filter, sort, paginate. The total count is taken before pagination.
     */
    public QueryResult search(QueryParameters parameters) {
        if (parameters.window().isEmpty()) {
            return emptyResult(parameters, "search");
        }
        List<LogRecord> filtered = applyFilters(parameters, parameters.window().get());
        QueryResult result = new QueryResult(
                parameters.requestId(), page(filtered, parameters), filtered.size(), List.of(), List.of());
        logResult("search", result);
        return result;
    }

    public QueryResult searchGroups(QueryParameters parameters) {
        if (parameters.window().isEmpty()) {
            return emptyResult(parameters, "searchGroups");
        }
        List<LogRecord> filtered = applyFilters(parameters, parameters.window().get());
        List<GroupNode> groups = groupingStage.group(filtered, parameters.groupBy());
        QueryResult result = new QueryResult(parameters.requestId(), List.of(), filtered.size(), groups, List.of());
        logResult("searchGroups", result);
        return result;
    }

    /**
     * Trend only; sort, grouping and paging of the request are ignored.
     */
    public QueryResult trend(QueryParameters parameters) {
        if (parameters.window().isEmpty()) {
            return emptyResult(parameters, "trend");
        }
        TimeWindow window = parameters.window().get();
        bucketPolicy.checkBucketCount(window);
        List<LogRecord> filtered = applyFilters(parameters, window);
        List<TrendPoint> chart = bucketingStage.bucketTrend(
                filtered, window, parameters.breakdownField().orElse(null));
        QueryResult result = new QueryResult(parameters.requestId(), List.of(), filtered.size(), List.of(), chart);
        logResult("trend", result);
        return result;
    }

    /**
     * Narrows the base query to records whose field text equals the clicked group or breakdown key,
     * one condition per drill-down field, and returns a flat page. The missing label selects records
     * without a value. A drill-down key replaces any base condition on the same field.
     */
    public QueryResult drillDown(QueryParameters parameters, Map<LogField, String> keys) {
        ColumnFilters merged = parameters.filters();
        for (Map.Entry<LogField, String> entry : keys.entrySet()) {
            merged = merged.with(entry.getKey(), FilterCondition.equalTo(entry.getValue()));
        }
        log.debug("Drill-down {} merged filters {}", parameters.requestId(), merged);
        return search(parameters.withFilters(merged).withoutGrouping());
    }

    /**
     * Every matching record in sort order, projected onto {@code columns}. Never paginated.
     */
    public ExportRows export(QueryParameters parameters, List<LogField> columns) {
        if (parameters.window().isEmpty()) {
            log.info("export {}: no time window, nothing to export", parameters.requestId());
            return new ExportRows(columns, List.of());
        }
        List<LogRecord> filtered = applyFilters(parameters, parameters.window().get());
        List<LogRecord> sorted = sortStage.sort(filtered, parameters.sort());
        ExportRows rows = new ExportRows(columns, exportProjector.project(sorted, columns));
        log.info("export {}: {} rows, {} columns", parameters.requestId(), rows.rows().size(), columns.size());
        return rows;
    }

    private List<LogRecord> applyFilters(QueryParameters parameters, TimeWindow window) {
        List<LogRecord> records = recordSource.snapshot();
        List<LogRecord> filtered = filterStage.filter(records, window, parameters.filters());
        log.debug("Request {} kept {} of {} records (window {} .. {}, filters {})",
                parameters.requestId(), filtered.size(), records.size(), window.from(), window.to(),
                parameters.filters());
        return filtered;
    }

    private List<LogRecord> page(List<LogRecord> filtered, QueryParameters parameters) {
        List<LogRecord> sorted = sortStage.sort(filtered, parameters.sort());
        return paginationStage.paginate(sorted, parameters.page(), parameters.pageSize());
    }

    private QueryResult emptyResult(QueryParameters parameters, String kind) {
        log.info("{} {}: no time window, returning empty result", kind, parameters.requestId());
        return QueryResult.empty(parameters.requestId());
    }

    private void logResult(String kind, QueryResult result) {
        log.info("{} {}: total={}, logs={}, groups={}, buckets={}",
                kind,
                result.requestId(),
                result.totalCount(),
                result.logs().size(),
                result.groupData().size(),
                result.chartData().size());
    }
}
