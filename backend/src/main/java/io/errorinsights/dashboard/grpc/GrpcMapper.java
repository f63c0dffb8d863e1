package io.errorinsights.dashboard.grpc;

import io.errorinsights.dashboard.model.GroupNode;
import io.errorinsights.dashboard.model.LogRecord;
import io.errorinsights.dashboard.model.TrendPoint;
import io.errorinsights.dashboard.report.ReportFormat;
import io.errorinsights.dashboard.service.dto.LogsQueryRequest;
import io.errorinsights.dashboard.service.dto.QueryResult;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Converts between the protobuf messages and the transport-neutral query types.
 * Empty proto strings and zero numbers stand for "not set".
 */
@Component
public class GrpcMapper {

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_OFFSET_DATE_TIME.withZone(ZoneOffset.UTC);

    public LogsQueryRequest toQueryRequest(QueryRequest request) {
        LogsQueryRequest.TimeRange range = request.hasTimeRange()
                ? new LogsQueryRequest.TimeRange(textOrNull(request.getTimeRange().getFrom()),
                        textOrNull(request.getTimeRange().getTo()))
                : null;
        LogsQueryRequest.Pagination pagination = request.hasPaging()
                ? new LogsQueryRequest.Pagination(
                        request.getPaging().getPage() == 0 ? null : request.getPaging().getPage(),
                        request.getPaging().getPageSize() == 0 ? null : request.getPaging().getPageSize())
                : null;
        LogsQueryRequest.Sort sort = request.hasSort()
                ? new LogsQueryRequest.Sort(textOrNull(request.getSort().getField()),
                        textOrNull(request.getSort().getDirection()))
                : null;

        Map<String, LogsQueryRequest.Filter> filters = new LinkedHashMap<>();
        request.getFiltersMap().forEach((field, clause) -> filters.put(field, new LogsQueryRequest.Filter(
                textOrNull(clause.getOperator()),
                List.copyOf(clause.getValuesList())
        )));

        return new LogsQueryRequest(
                textOrNull(request.getRequestId()),
                range,
                textOrNull(request.getInterval()),
                pagination,
                sort,
                filters,
                List.copyOf(request.getGroupByList()),
                textOrNull(request.getBreakdownField())
        );
    }

    public Optional<ReportFormat> toReportFormat(io.errorinsights.dashboard.grpc.ReportFormat format) {
        return switch (format) {
            case REPORT_FORMAT_UNSPECIFIED, REPORT_FORMAT_CSV -> Optional.of(ReportFormat.CSV);
            case REPORT_FORMAT_JSON -> Optional.of(ReportFormat.JSON);
            case REPORT_FORMAT_PDF -> Optional.of(ReportFormat.PDF);
            default -> Optional.empty();
        };
    }

    public QueryResponse toQueryResponse(QueryResult result) {
        QueryResponse.Builder builder = QueryResponse.newBuilder()
                .setRequestId(Optional.ofNullable(result.requestId()).orElse(""))
                .setTotalCount(result.totalCount());
        result.logs().stream().map(this::toLogItem).forEach(builder::addLogs);
        result.groupData().stream().map(this::toGroupItem).forEach(builder::addGroupData);
        result.chartData().stream().map(this::toTrendItem).forEach(builder::addChartData);
        return builder.build();
    }

    public LogItem toLogItem(LogRecord record) {
        return LogItem.newBuilder()
                .setId(Optional.ofNullable(record.id()).orElse(""))
                .setLogDateTime(format(record.logDateTime()))
                .setHostName(Optional.ofNullable(record.hostName()).orElse(""))
                .setRepositoryPath(Optional.ofNullable(record.repositoryPath()).orElse(""))
                .setPortNumber(Optional.ofNullable(record.portNumber()).orElse(0))
                .setVersionNumber(Optional.ofNullable(record.versionNumber()).orElse(""))
                .setAsServerMode(Optional.ofNullable(record.asServerMode()).orElse(""))
                .setAsStartDateTime(format(record.asStartDateTime()))
                .setAsServerConfig(Optional.ofNullable(record.asServerConfig()).orElse(""))
                .setUserId(Optional.ofNullable(record.userId()).orElse(""))
                .setReportIdName(Optional.ofNullable(record.reportIdName()).orElse(""))
                .setErrorNumber(Optional.ofNullable(record.errorNumber()).orElse(0))
                .setXqlQueryId(Optional.ofNullable(record.xqlQueryId()).orElse(""))
                .setLogMessage(Optional.ofNullable(record.logMessage()).orElse(""))
                .build();
    }

    public GroupItem toGroupItem(GroupNode node) {
        GroupItem.Builder builder = GroupItem.newBuilder()
                .setKey(node.key())
                .setCount(node.count());
        node.subgroups().stream().map(this::toGroupItem).forEach(builder::addSubgroups);
        return builder.build();
    }

    public TrendItem toTrendItem(TrendPoint point) {
        return TrendItem.newBuilder()
                .setBucketStart(format(point.bucketStart()))
                .setCount(point.count())
                .putAllBreakdown(point.breakdown())
                .build();
    }

    private String format(Instant instant) {
        return instant == null ? "" : ISO.format(instant);
    }

    private String textOrNull(String value) {
        return StringUtils.hasText(value) ? value : null;
    }
}
