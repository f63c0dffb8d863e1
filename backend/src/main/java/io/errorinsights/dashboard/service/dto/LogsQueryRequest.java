package io.errorinsights.dashboard.service.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import java.util.List;
import java.util.Map;

/**
 * Query as sent by the dashboard, before validation. Every part is optional.
 */
public record LogsQueryRequest(
        String requestId,
        @JsonAlias("dateRange") TimeRange timeWindow,
        String interval,
        Pagination pagination,
        Sort sort,
        Map<String, Filter> filters,
        List<String> groupBy,
        @JsonAlias("chartBreakdownBy") String breakdownField) {

    public record TimeRange(String from, String to) {
    }

    public record Pagination(Integer page, Integer pageSize) {
    }

    public record Sort(@JsonAlias("column") String field, String direction) {
    }

    public record Filter(String operator, List<String> values) {
    }
}
