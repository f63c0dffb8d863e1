package io.errorinsights.dashboard.service.dto;

import io.errorinsights.dashboard.model.GroupNode;
import io.errorinsights.dashboard.model.LogRecord;
import io.errorinsights.dashboard.model.TrendPoint;
import java.util.List;

public record QueryResult(
        String requestId,
        List<LogRecord> logs,
        long totalCount,
        List<GroupNode> groupData,
        List<TrendPoint> chartData) {

    public static QueryResult empty(String requestId) {
        return new QueryResult(requestId, List.of(), 0, List.of(), List.of());
    }
}
